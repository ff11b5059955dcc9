package org.nowstart.rampart.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.RouterStatus;
import org.nowstart.rampart.data.dto.StopAmendment;
import org.nowstart.rampart.service.RuntimeRouter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/router")
@Tag(name = "Router", description = "실시간/페이퍼 라우터 바 입력, 엔게이지먼트 제출, 상태 조회 API")
public class RouterController {

    private final RuntimeRouter runtimeRouter;

    public RouterController(RuntimeRouter runtimeRouter) {
        this.runtimeRouter = runtimeRouter;
    }

    @PostMapping("/instruments/{instrument}/bars")
    @Operation(summary = "바 입력", description = "종목 워커의 피드에 새 바를 넣습니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "접수"),
            @ApiResponse(responseCode = "404", description = "알 수 없는 종목"),
            @ApiResponse(responseCode = "409", description = "라우터 정지 또는 종목 중단"),
            @ApiResponse(responseCode = "503", description = "피드 포화")
    })
    public ResponseEntity<Void> publishBar(@PathVariable String instrument, @RequestBody Bar bar) {
        runtimeRouter.publishBar(instrument, bar);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/instruments/{instrument}/engagements")
    @Operation(summary = "엔게이지먼트 제출", description = "다음 바에서 평가될 엔게이지먼트를 대기열에 넣습니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "접수"),
            @ApiResponse(responseCode = "404", description = "알 수 없는 종목"),
            @ApiResponse(responseCode = "409", description = "라우터 정지 또는 종목 중단")
    })
    public ResponseEntity<Void> submitEngagement(@PathVariable String instrument, @RequestBody Engagement engagement) {
        runtimeRouter.submitEngagement(instrument, engagement);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/instruments/{instrument}/stop-amendments")
    @Operation(summary = "손절가 변경", description = "다음 바에서 적용될 손절가 변경을 대기열에 넣습니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "접수"),
            @ApiResponse(responseCode = "404", description = "알 수 없는 종목"),
            @ApiResponse(responseCode = "409", description = "라우터 정지 또는 종목 중단")
    })
    public ResponseEntity<Void> amendStop(@PathVariable String instrument, @RequestBody StopAmendment amendment) {
        runtimeRouter.amendStop(instrument, amendment);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/instruments/{instrument}/positions/{positionId}/rejections")
    @Operation(summary = "브로커 거부 통보", description = "페이퍼 포지션에 대한 비동기 브로커 거부를 기록합니다. 다음 바 시가에 강제 청산됩니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "접수"),
            @ApiResponse(responseCode = "404", description = "알 수 없는 종목"),
            @ApiResponse(responseCode = "409", description = "라우터 정지 또는 종목 중단")
    })
    public ResponseEntity<Void> reportRejection(
            @PathVariable String instrument,
            @PathVariable String positionId,
            @RequestParam(value = "reason", required = false) String reason
    ) {
        runtimeRouter.reportRejection(instrument, positionId, reason);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/status")
    @Operation(summary = "라우터 상태 조회", description = "계정 스냅샷과 종목별 처리 현황을 조회합니다.")
    public RouterStatus status() {
        return runtimeRouter.status();
    }

    @PostMapping("/stop")
    @Operation(summary = "라우터 정지", description = "모든 피드를 종료하고 남은 포지션을 강제 청산한 뒤 워커를 정리합니다.")
    public RouterStatus stop() {
        runtimeRouter.stop();
        return runtimeRouter.status();
    }
}
