package com.geoinsight.backend.controller;

import com.geoinsight.backend.dto.InvestmentAnalysisResponse;
import com.geoinsight.backend.model.InvestmentInput;
import com.geoinsight.backend.service.InvestmentAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/investment")
@Tag(name = "Investment", description = "Synchronous investment calculator")
public class InvestmentController {

    private final InvestmentAnalysisService investmentAnalysisService;

    public InvestmentController(InvestmentAnalysisService investmentAnalysisService) {
        this.investmentAnalysisService = investmentAnalysisService;
    }

    @PostMapping("/analyze")
    @Operation(summary = "Analyze investment", description = "Cash flow, DSCR, cap rate, IRR and related metrics")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Metrics computed"),
            @ApiResponse(responseCode = "400", description = "Unparseable amount or invalid terms"),
            @ApiResponse(responseCode = "422", description = "IRR could not be determined")
    })
    public ResponseEntity<InvestmentAnalysisResponse> analyze(@Valid @RequestBody InvestmentInput input) {
        return ResponseEntity.ok(investmentAnalysisService.analyze(input));
    }
}
