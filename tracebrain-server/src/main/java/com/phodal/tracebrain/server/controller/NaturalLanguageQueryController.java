package com.phodal.tracebrain.server.controller;

import com.phodal.tracebrain.query.QueryResult;
import com.phodal.tracebrain.server.dto.NaturalLanguageQueryRequest;
import com.phodal.tracebrain.server.service.NaturalLanguageQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/natural_language_query")
@RequiredArgsConstructor
public class NaturalLanguageQueryController {

    private final NaturalLanguageQueryService queryService;

    @PostMapping
    public QueryResult query(@RequestBody NaturalLanguageQueryRequest request) {
        return queryService.answer(request.getQuery());
    }
}
