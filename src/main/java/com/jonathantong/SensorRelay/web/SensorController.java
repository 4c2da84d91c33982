package com.jonathantong.SensorRelay.web;

import com.jonathantong.SensorRelay.model.SensorReading;
import com.jonathantong.SensorRelay.service.SensorHistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time query of the latest stored values, independent of the binlog stream
 */
@RestController
@RequestMapping("/api")
public class SensorController {

    private static final Logger logger = LoggerFactory.getLogger(SensorController.class);

    private final SensorHistoryService sensorHistoryService;

    @Autowired
    public SensorController(SensorHistoryService sensorHistoryService) {
        this.sensorHistoryService = sensorHistoryService;
    }

    /** Latest {@code limit} values per watched entity; failures are reported in the body. */
    @GetMapping("/sensors")
    public Map<String, Object> getSensors(@RequestParam(name = "limit", defaultValue = "5") int limit) {
        if (limit < 1) {
            return errorResponse("limit must be a positive number");
        }

        try {
            Map<String, List<SensorReading>> data = sensorHistoryService.latestReadings(limit);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("data", data);
            return response;
        } catch (DataAccessException e) {
            logger.error("Failed to read sensor history: {}", e.getMessage(), e);
            return errorResponse(e.getMessage());
        }
    }

    private Map<String, Object> errorResponse(String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", message);
        response.put("data", Map.of());
        return response;
    }
}
