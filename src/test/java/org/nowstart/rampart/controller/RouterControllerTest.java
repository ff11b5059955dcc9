package org.nowstart.rampart.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.rampart.data.dto.AccountSnapshot;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.InstrumentStatus;
import org.nowstart.rampart.data.dto.RouterStatus;
import org.nowstart.rampart.data.dto.StopAmendment;
import org.nowstart.rampart.data.dto.TakeProfitLevel;
import org.nowstart.rampart.data.type.Direction;
import org.nowstart.rampart.data.type.ExecutionMode;
import org.nowstart.rampart.service.RuntimeRouter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@ExtendWith(MockitoExtension.class)
class RouterControllerTest {

    @Mock
    private RuntimeRouter runtimeRouter;

    @InjectMocks
    private RouterController controller;

    @Test
    void publishBar_returnsAccepted() {
        Bar bar = new Bar(Instant.parse("2024-01-02T00:00:00Z"), 1.1, 1.2, 1.0, 1.15, 10.0);

        ResponseEntity<Void> response = controller.publishBar("EUR_USD", bar);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        verify(runtimeRouter).publishBar("EUR_USD", bar);
    }

    @Test
    void submitEngagement_returnsAccepted() {
        Engagement engagement = new Engagement("e-1", Direction.LONG, 1.1, 10.0, List.of(new TakeProfitLevel(20.0, 1.0)), 1000.0);

        ResponseEntity<Void> response = controller.submitEngagement("EUR_USD", engagement);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        verify(runtimeRouter).submitEngagement("EUR_USD", engagement);
    }

    @Test
    void amendStop_returnsAccepted() {
        StopAmendment amendment = new StopAmendment("EUR_USD-1", 1.0995);

        ResponseEntity<Void> response = controller.amendStop("EUR_USD", amendment);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        verify(runtimeRouter).amendStop("EUR_USD", amendment);
    }

    @Test
    void reportRejection_returnsAccepted() {
        ResponseEntity<Void> response = controller.reportRejection("EUR_USD", "EUR_USD-1", "margin");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        verify(runtimeRouter).reportRejection("EUR_USD", "EUR_USD-1", "margin");
    }

    @Test
    void status_delegatesToRouter() {
        RouterStatus status = status(true);
        when(runtimeRouter.status()).thenReturn(status);

        assertThat(controller.status()).isEqualTo(status);
    }

    @Test
    void stop_stopsRouterBeforeReportingStatus() {
        RouterStatus status = status(false);
        when(runtimeRouter.status()).thenReturn(status);

        RouterStatus result = controller.stop();

        assertThat(result).isEqualTo(status);
        InOrder order = inOrder(runtimeRouter);
        order.verify(runtimeRouter).stop();
        order.verify(runtimeRouter).status();
    }

    private RouterStatus status(boolean running) {
        return new RouterStatus(
                running,
                ExecutionMode.PAPER,
                new AccountSnapshot(100_000.0, 100_000.0, null, 100_000.0),
                List.of(new InstrumentStatus("EUR_USD", running, 12L, 1, 0, null))
        );
    }
}
