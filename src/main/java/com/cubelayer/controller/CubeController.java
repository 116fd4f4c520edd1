package com.cubelayer.controller;

import com.cubelayer.meta.Loader;
import com.cubelayer.service.CubeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/cubes")
public class CubeController {
    private static final Logger logger = LoggerFactory.getLogger(CubeController.class);

    private final CubeService cubeService;

    public CubeController(CubeService cubeService) {
        this.cubeService = cubeService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Map<String, Object>>>> listCubes() {
        return ResponseEntity.ok(ApiResponse.success(cubeService.listCubes()));
    }

    @GetMapping("/{name}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getCube(@PathVariable String name) {
        try {
            return ResponseEntity.ok(ApiResponse.success(cubeService.getCube(name)));
        } catch (Loader.NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, e.getMessage()));
        }
    }

    /**
     * 当前快照的加载报告：生效的立方体与被拒绝的立方体
     */
    @GetMapping("/status")
    public ResponseEntity<ApiResponse<Map<String, Object>>> status() {
        return ResponseEntity.ok(ApiResponse.success(cubeService.loadReport()));
    }

    @PostMapping("/reload")
    public ResponseEntity<ApiResponse<Map<String, Object>>> reload() {
        try {
            return ResponseEntity.ok(ApiResponse.success(cubeService.reload()));
        } catch (IOException e) {
            logger.error("Failed to reload cube declarations", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(500, "Failed to reload cube declarations: " + e.getMessage()));
        }
    }
}
