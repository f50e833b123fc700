package org.iceforge.dataseap.config;

import org.iceforge.dataseap.engine.EndpointSelector;
import org.iceforge.dataseap.engine.EngineClientConfig;
import org.iceforge.dataseap.engine.EngineTransport;
import org.iceforge.dataseap.engine.SelectionPolicy;
import org.iceforge.dataseap.engine.load.HttpStreamLoadClient;
import org.iceforge.dataseap.engine.load.StreamLoadClient;
import org.iceforge.dataseap.engine.query.HttpQueryExecutor;
import org.iceforge.dataseap.engine.query.QueryExecutor;
import org.iceforge.dataseap.engine.txn.HttpTransactionCoordinator;
import org.iceforge.dataseap.engine.txn.TransactionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class EngineClientConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineClientConfiguration.class);

    @Bean(destroyMethod = "close")
    public EngineTransport engineTransport(EngineProperties props, ObjectProvider<WebClient.Builder> builders) {
        EngineClientConfig config = props.toClientConfig();
        log.info("Engine client configured: {}", config);
        return new EngineTransport(config, builders.getIfAvailable(WebClient::builder));
    }

    @Bean
    public EndpointSelector queryEndpointSelector(EngineTransport transport) {
        EngineClientConfig config = transport.config();
        return new EndpointSelector(config.queryEndpoints(), config.querySelection());
    }

    /** Shared by stream load and 2PC control so both advance the same rotation. */
    @Bean
    public EndpointSelector loadEndpointSelector(EngineTransport transport) {
        return new EndpointSelector(transport.config().loadEndpoints(), SelectionPolicy.ROUND_ROBIN);
    }

    @Bean
    public QueryExecutor queryExecutor(EngineTransport transport,
                                       @Qualifier("queryEndpointSelector") EndpointSelector selector) {
        return new HttpQueryExecutor(transport, selector);
    }

    @Bean
    public StreamLoadClient streamLoadClient(EngineTransport transport,
                                             @Qualifier("loadEndpointSelector") EndpointSelector selector) {
        return new HttpStreamLoadClient(transport, selector);
    }

    @Bean
    public TransactionCoordinator transactionCoordinator(EngineTransport transport,
                                                         @Qualifier("loadEndpointSelector") EndpointSelector selector) {
        return new HttpTransactionCoordinator(transport, selector);
    }
}
