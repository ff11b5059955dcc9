package org.nowstart.rampart.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.rampart.config.RampartExceptionHandler;
import org.nowstart.rampart.data.dto.AccountSnapshot;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.dto.SimulationRequest;
import org.nowstart.rampart.data.dto.SimulationResult;
import org.nowstart.rampart.data.dto.SimulationSummary;
import org.nowstart.rampart.service.SimulationService;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SimulationControllerTest {

    @Mock
    private SimulationService simulationService;

    @InjectMocks
    private SimulationController controller;

    @Test
    void run_delegatesToService() {
        Bar bar = new Bar(Instant.parse("2024-01-02T00:00:00Z"), 1.1, 1.2, 1.0, 1.15, 10.0);
        SimulationRequest request = new SimulationRequest("EUR_USD", List.of(bar), null, null, null);
        SimulationResult result = new SimulationResult(
                "EUR_USD",
                List.of(),
                List.of(),
                new AccountSnapshot(100_000.0, 100_000.0, null, 100_000.0),
                List.of(),
                List.of(),
                new SimulationSummary(1, 0, 0, 0.0, 0.0, 0.0, 0.0, 100_000.0, 100_000.0, 0.0, 0, 0, 0, "")
        );
        when(simulationService.run(request)).thenReturn(result);

        assertThat(controller.run(request)).isEqualTo(result);
        assertThat(request.engagements()).isEmpty();
        verify(simulationService).run(request);
    }

    @Test
    void run_answersBadRequestForRejectedSafetyOverride() throws Exception {
        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new RampartExceptionHandler())
                .build();
        String body = "{\"instrument\":\"EUR_USD\","
                + "\"bars\":[{\"timestamp\":\"2024-01-02T00:00:00Z\",\"open\":1.1,\"high\":1.2,\"low\":1.0,\"close\":1.15,\"volume\":10}],"
                + "\"safety\":{\"maxStopLossPips\":-1,\"winnerRewardRiskThreshold\":2.5,\"breakevenBufferPips\":1,"
                + "\"zombieStalenessBars\":40,\"zombieStepPips\":5,\"trailingDistancePips\":0}}";

        mockMvc.perform(post("/api/simulations").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_argument"));
        verify(simulationService, never()).run(any());
    }
}
