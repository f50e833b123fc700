package org.iceforge.dataseap;

import org.iceforge.dataseap.api.HealthController;
import org.iceforge.dataseap.engine.EndpointRole;
import org.iceforge.dataseap.engine.EndpointSelector;
import org.iceforge.dataseap.engine.EngineTransport;
import org.iceforge.dataseap.engine.SelectionPolicy;
import org.iceforge.dataseap.search.SearchOrchestrator;
import org.iceforge.dataseap.txn.TransactionService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        properties = {
                "dataseap.engine.hosts=fe1:8030,fe2:8030",
                "dataseap.engine.load-hosts=be1:8040",
                "dataseap.engine.query-selection=ROUND_ROBIN",
                "dataseap.transactions.sweep-enabled=false"
        }
)
class DataseapApplicationWiringTest {

    @Test
    void contextWiresEngineClientAndServices(ApplicationContext ctx) {
        EndpointSelector query = ctx.getBean("queryEndpointSelector", EndpointSelector.class);
        EndpointSelector load = ctx.getBean("loadEndpointSelector", EndpointSelector.class);

        assertThat(query.endpoints()).hasSize(2).allMatch(e -> e.role() == EndpointRole.QUERY);
        assertThat(query.policy()).isEqualTo(SelectionPolicy.ROUND_ROBIN);
        assertThat(load.endpoints()).singleElement().satisfies(e -> {
            assertThat(e.host()).isEqualTo("be1");
            assertThat(e.port()).isEqualTo(8040);
        });

        assertThat(ctx.getBean("searchExecutor")).isInstanceOf(ExecutorService.class);
        assertThat(ctx.getBean(EngineTransport.class).config().hosts()).containsExactly("fe1:8030", "fe2:8030");
        assertThat(ctx.getBean(SearchOrchestrator.class)).isNotNull();
        assertThat(ctx.getBean(TransactionService.class)).isNotNull();
        assertThat(ctx.getBean(HealthController.class)).isNotNull();
        assertThat(ctx.getBean(HealthEndpoint.class)).isNotNull();
    }
}
