package com.cubelayer.controller;

import com.cubelayer.query.CompiledQuery;
import com.cubelayer.query.QueryException;
import com.cubelayer.service.QueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 查询编译控制器：返回 SQL 与列清单，不执行查询
 */
@RestController
@RequestMapping("/api/v1")
public class QueryController {
    private static final Logger logger = LoggerFactory.getLogger(QueryController.class);

    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    @PostMapping("/sql")
    public ResponseEntity<ApiResponse<CompiledQuery>> compile(@RequestBody Map<String, Object> queryRequest) {
        try {
            return ResponseEntity.ok(ApiResponse.success(queryService.compile(queryRequest)));
        } catch (QueryException e) {
            return badRequest(e);
        }
    }

    @PostMapping("/drill-down")
    public ResponseEntity<ApiResponse<Map<String, Object>>> drillDown(@RequestBody Map<String, Object> body) {
        try {
            return ResponseEntity.ok(ApiResponse.success(queryService.drillDown(body)));
        } catch (QueryException e) {
            return badRequest(e);
        }
    }

    private static <T> ResponseEntity<ApiResponse<T>> badRequest(QueryException e) {
        logger.warn("Query rejected [{}]: {}", e.getKind(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ApiResponse.error(400, e.getKind() + ": " + e.getMessage()));
    }
}
