package co.fanki.markupgraph.config;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint for the analysis service.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    /**
     * Returns health status.
     *
     * @return "up" while the service accepts requests
     */
    @GetMapping("/health")
    public String health() {
        return "up";
    }

}
