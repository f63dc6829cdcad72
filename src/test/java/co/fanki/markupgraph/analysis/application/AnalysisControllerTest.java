package co.fanki.markupgraph.analysis.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.HashMap;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for {@link AnalysisController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisControllerTest {

    private static final String DOCUMENT = "<div id=\"app\">"
            + "<p class=\"t\">Hi</p><style>.t{color:red}</style></div>";

    private final ObjectMapper mapper = new ObjectMapper();

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        final AnalysisService service = new AnalysisService(
                new GraphQueryService(), "ECMASCRIPT_NEXT", "CSS30");
        mockMvc = MockMvcBuilders.standaloneSetup(
                new AnalysisController(service)).build();
    }

    private String body(final Map<String, Object> fields) throws Exception {
        return mapper.writeValueAsString(fields);
    }

    @Test
    void whenAnalyzing_givenDocument_shouldReturnGraphJson() throws Exception {
        mockMvc.perform(post("/api/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("document", DOCUMENT))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes.length()").value(6))
                .andExpect(jsonPath("$.nodes[0].name").value("html"))
                .andExpect(jsonPath("$.edges[5].type")
                        .value("stylesheet-use"))
                .andExpect(jsonPath("$.edges[5].label").value(".t"));
    }

    @Test
    void whenQuerying_givenValidQuery_shouldReturnResults() throws Exception {
        mockMvc.perform(post("/api/analysis/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("document", DOCUMENT,
                                "query", "stylesheets"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query").value("stylesheets"))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.results[0].name")
                        .value("inline-stylesheet"));
    }

    @Test
    void whenQuerying_givenInvalidQuery_shouldReturnBadRequest()
            throws Exception {
        mockMvc.perform(post("/api/analysis/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("document", DOCUMENT,
                                "query", "+content"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_QUERY"));
    }

    @Test
    void whenAnalyzing_givenMissingDocument_shouldReturnBadRequest()
            throws Exception {
        final Map<String, Object> fields = new HashMap<>();
        fields.put("document", null);

        mockMvc.perform(post("/api/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(fields)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_INPUT"));
    }

    @Test
    void whenSummarizing_givenDocument_shouldReturnCounts() throws Exception {
        mockMvc.perform(post("/api/analysis/summary")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("document", DOCUMENT,
                                "externalStylesheets", Map.of()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes.element").value(5))
                .andExpect(jsonPath("$.nodes.stylesheet").value(1))
                .andExpect(jsonPath("$.edges['stylesheet-use']").value(1));
    }
}
