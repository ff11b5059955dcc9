package org.nowstart.rampart.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.rampart.data.dto.SimulationRequest;
import org.nowstart.rampart.data.dto.SimulationResult;
import org.nowstart.rampart.service.SimulationService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/simulations")
@Tag(name = "Simulation", description = "바 단위 백테스트 실행 API")
public class SimulationController {

    private final SimulationService simulationService;

    public SimulationController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @PostMapping
    @Operation(summary = "시뮬레이션 실행", description = "전달된 바와 엔게이지먼트 일정으로 한 번의 시뮬레이션을 실행합니다. safety 값을 주면 설정된 안전 법칙을 대체합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "실행 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "422", description = "바 피드 무결성 오류")
    })
    public SimulationResult run(@RequestBody @Valid SimulationRequest request) {
        return simulationService.run(request);
    }
}
