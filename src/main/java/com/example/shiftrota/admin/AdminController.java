package com.example.shiftrota.admin;

import com.example.shiftrota.common.ApiResponse;
import com.example.shiftrota.common.error.ErrorLogBuffer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final ErrorLogBuffer errorLogBuffer;

    public AdminController(ErrorLogBuffer errorLogBuffer) {
        this.errorLogBuffer = errorLogBuffer;
    }

    @GetMapping("/error-logs")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getErrorLogs(@RequestParam(name = "limit", required = false) Integer limit) {
        List<ErrorLogBuffer.Entry> list = errorLogBuffer.recent();
        if (limit != null && limit > 0 && list.size() > limit) list = list.subList(0, limit);
        Map<String, Object> resp = new HashMap<>();
        resp.put("count", list.size());
        resp.put("items", list);
        return ResponseEntity.ok(ApiResponse.success("recent error logs", resp));
    }

    @DeleteMapping("/error-logs")
    public ResponseEntity<ApiResponse<Map<String, Object>>> clearErrorLogs() {
        int cleared = errorLogBuffer.recent().size();
        errorLogBuffer.clear();
        return ResponseEntity.ok(ApiResponse.success("error logs cleared", Map.of("cleared", cleared)));
    }
}
