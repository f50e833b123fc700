package org.iceforge.dataseap.search;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class SearchConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService searchExecutor(SearchProperties props) {
        int threads = Math.max(1, props.getParallelism());
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "dataseap-search-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
