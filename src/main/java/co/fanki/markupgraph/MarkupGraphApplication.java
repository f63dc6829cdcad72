package co.fanki.markupgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Markup Graph Application.
 *
 * <p>This is the main entry point for the Markup Graph service, which
 * turns an HTML document with its inline scripts and stylesheets into a
 * typed graph of elements, script declarations and style links.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class MarkupGraphApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(MarkupGraphApplication.class, args);
    }

}
