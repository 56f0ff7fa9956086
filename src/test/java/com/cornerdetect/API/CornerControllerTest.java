package com.cornerdetect.API;

import com.cornerdetect.detector.CornerDetectorTest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class CornerControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        CornerDetectionService service = new CornerDetectionService();
        ReflectionTestUtils.setField(service, "properties", new CornerDetectionProperties());
        CornerController controller = new CornerController();
        ReflectionTestUtils.setField(controller, "cornerDetectionService", service);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    private String body(Map<String, Object> fields) throws Exception {
        return mapper.writeValueAsString(fields);
    }

    @Test
    public void testDetectCorners() throws Exception {
        Map<String, Object> req = new HashMap<>();
        req.put("image", CornerDetectorTest.twoBlobImage());
        req.put("n", 2);

        mockMvc.perform(post("/api/corners").contentType(MediaType.APPLICATION_JSON).content(body(req)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.u", hasSize(2)))
                .andExpect(jsonPath("$.v", hasSize(2)))
                .andExpect(jsonPath("$.u[0]").value(15))
                .andExpect(jsonPath("$.v[0]").value(15));
    }

    @Test
    public void testZippedWithResponseMap() throws Exception {
        Map<String, Object> req = new HashMap<>();
        req.put("image", CornerDetectorTest.twoBlobImage());
        req.put("n", 2);
        req.put("zipped", true);
        req.put("includeResponse", true);

        mockMvc.perform(post("/api/corners").contentType(MediaType.APPLICATION_JSON).content(body(req)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.points", hasSize(2)))
                .andExpect(jsonPath("$.points[1][0]").value(34))
                .andExpect(jsonPath("$.points[1][1]").value(35))
                .andExpect(jsonPath("$.response", hasSize(50)));
    }

    @Test
    public void testInvalidBoundaryModeIsBadRequest() throws Exception {
        Map<String, Object> req = new HashMap<>();
        req.put("image", new double[][]{{1, 2, 3}, {4, 5, 6}, {7, 8, 9}});
        req.put("boundaryMode", "reflect");

        mockMvc.perform(post("/api/corners").contentType(MediaType.APPLICATION_JSON).content(body(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("invalid boundary mode")));
    }

    @Test
    public void testMissingOrRaggedImageIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/corners").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());

        Map<String, Object> req = new HashMap<>();
        req.put("image", new double[][]{{1, 2, 3}, {4, 5}});
        mockMvc.perform(post("/api/harris").contentType(MediaType.APPLICATION_JSON).content(body(req)))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testHarrisEndpoint() throws Exception {
        Map<String, Object> req = new HashMap<>();
        req.put("image", new double[20][30]);
        req.put("boundaryMode", "mirror");

        mockMvc.perform(post("/api/harris").contentType(MediaType.APPLICATION_JSON).content(body(req)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.height").value(20))
                .andExpect(jsonPath("$.width").value(30))
                .andExpect(jsonPath("$.response", hasSize(20)))
                .andExpect(jsonPath("$.response[0]", hasSize(30)));
    }

    @Test
    public void testEdgeLargerThanImageReturnsNoCorners() throws Exception {
        Map<String, Object> req = new HashMap<>();
        req.put("image", CornerDetectorTest.twoBlobImage());
        req.put("variant", "KD_TREE");
        req.put("edge", Integer.MAX_VALUE);

        mockMvc.perform(post("/api/corners").contentType(MediaType.APPLICATION_JSON).content(body(req)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0))
                .andExpect(jsonPath("$.u", hasSize(0)));
    }
}
