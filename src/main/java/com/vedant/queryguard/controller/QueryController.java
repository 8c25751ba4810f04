package com.vedant.queryguard.controller;

import com.vedant.queryguard.dto.NLQueryRequestDTO;
import com.vedant.queryguard.dto.NLQueryResponseDTO;
import com.vedant.queryguard.dto.SqlCheckRequestDTO;
import com.vedant.queryguard.model.AuditEntry;
import com.vedant.queryguard.model.PipelineResult;
import com.vedant.queryguard.model.SecurityReport;
import com.vedant.queryguard.service.QueryService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/query")
public class QueryController {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String USER_EMAIL_HEADER = "X-User-Email";

    private final QueryService queryService;
    private final int defaultHistoryLimit;

    public QueryController(QueryService queryService,
                           @Value("${queryguard.audit.history-limit:50}") int defaultHistoryLimit) {
        this.queryService = queryService;
        this.defaultHistoryLimit = defaultHistoryLimit;
    }

    // failures are mapped by ApiExceptionHandler
    @PostMapping("/nl")
    public ResponseEntity<NLQueryResponseDTO> nlQuery(@RequestBody NLQueryRequestDTO req, HttpServletRequest request) {
        PipelineResult result = queryService.executeNlQuery(req.getNlQuery(), userId(request),
                request.getHeader(USER_EMAIL_HEADER));
        return ResponseEntity.ok(NLQueryResponseDTO.from(result));
    }

    @PostMapping("/check")
    public ResponseEntity<SecurityReport> check(@RequestBody SqlCheckRequestDTO req) {
        return ResponseEntity.ok(queryService.checkStatement(req.getSql()));
    }

    @GetMapping("/audit-history")
    public ResponseEntity<List<AuditEntry>> auditHistory(@RequestParam(required = false) Integer limit,
                                                         HttpServletRequest request) {
        int n = limit == null || limit <= 0 ? defaultHistoryLimit : limit;
        return ResponseEntity.ok(queryService.auditHistory(userId(request), n));
    }

    // authentication lives outside this service; fall back to the HTTP session as identity
    private String userId(HttpServletRequest request) {
        String header = request.getHeader(USER_ID_HEADER);
        if (header != null && !header.isBlank()) return header.trim();
        return request.getSession().getId();
    }
}
