package io.clubone.order.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool for the parallel order and quotation reads of the merged feed.
 */
@Configuration
public class FeedExecutorConfig {

	@Value("${order.feed.pool-size:4}")
	private int poolSize;

	@Value("${order.feed.queue-capacity:100}")
	private int queueCapacity;

	@Bean("orderFeedExecutor")
	public ThreadPoolTaskExecutor orderFeedExecutor() {
		ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
		executor.setCorePoolSize(poolSize);
		executor.setMaxPoolSize(poolSize);
		executor.setQueueCapacity(queueCapacity);
		executor.setThreadNamePrefix("order-feed-");
		executor.setWaitForTasksToCompleteOnShutdown(true);
		executor.initialize();
		return executor;
	}
}
