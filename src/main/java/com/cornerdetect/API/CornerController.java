package com.cornerdetect.API;

import com.cornerdetect.ANMS.AnmsResult;
import com.cornerdetect.detector.CornerDetectionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*") // Cho phép gọi từ file HTML bất kỳ
public class CornerController {

    @Autowired
    private CornerDetectionService cornerDetectionService;

    @PostMapping(value = "/corners", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> detectCorners(@RequestBody CornerRequest request) {
        try {
            CornerDetectionResult result = cornerDetectionService.detect(request);
            AnmsResult corners = result.getCorners();

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("count", corners.size());
            if (request.isZipped()) {
                response.put("points", corners.getZipped());
            } else {
                response.put("u", corners.getU());
                response.put("v", corners.getV());
            }
            if (request.isIncludeResponse()) {
                response.put("response", result.getResponse());
            }
            return ResponseEntity.ok().body(response);

        } catch (IllegalArgumentException e) {
            return badRequest(e);
        } catch (Exception e) {
            return internalError(e);
        }
    }

    @PostMapping(value = "/harris", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> harrisResponse(@RequestBody HarrisRequest request) {
        try {
            double[][] h = cornerDetectionService.harris(request);
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("height", h.length);
            response.put("width", h[0].length);
            response.put("response", h);
            return ResponseEntity.ok().body(response);

        } catch (IllegalArgumentException e) {
            return badRequest(e);
        } catch (Exception e) {
            return internalError(e);
        }
    }

    private static ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("Tham số không hợp lệ: {}", e.getMessage());
        Map<String, String> error = new HashMap<>();
        error.put("error", e.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    private static ResponseEntity<Map<String, String>> internalError(Exception e) {
        log.error("Lỗi khi xử lý ảnh", e);
        Map<String, String> error = new HashMap<>();
        error.put("error", "Lỗi: " + e.getMessage());
        return ResponseEntity.internalServerError().body(error);
    }
}
