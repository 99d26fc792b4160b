package com.ownding.telemetry.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class RetentionConfig {

    private static final int WORKER_QUEUE_CAPACITY = 10_000;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TransactionTemplate retentionTransactionTemplate(PlatformTransactionManager transactionManager,
            AppProperties appProperties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);
        // cycles may start from an afterCommit callback, where a joined transaction never commits again
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setTimeout((int) Math.max(1, appProperties.getRetention().getTransactionTimeout().toSeconds()));
        return template;
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler retentionScheduler(AppProperties appProperties) {
        return Schedulers.newBoundedElastic(
                appProperties.getRetention().getWorkerThreads(),
                WORKER_QUEUE_CAPACITY,
                "retention-worker");
    }
}
