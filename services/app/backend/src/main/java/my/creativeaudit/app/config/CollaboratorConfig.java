package my.creativeaudit.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import my.creativeaudit.app.collaborator.AnalyticsWarehouseClient;
import my.creativeaudit.app.collaborator.AnnotationClient;
import my.creativeaudit.app.collaborator.CallPolicy;
import my.creativeaudit.app.collaborator.ChatNotifier;
import my.creativeaudit.app.collaborator.ContentUnderstandingClient;
import my.creativeaudit.app.collaborator.FfmpegMediaToolkit;
import my.creativeaudit.app.collaborator.HttpAnalyticsWarehouseClient;
import my.creativeaudit.app.collaborator.HttpAnnotationClient;
import my.creativeaudit.app.collaborator.HttpContentUnderstandingClient;
import my.creativeaudit.app.collaborator.HttpObjectStorageClient;
import my.creativeaudit.app.collaborator.HttpPaymentProcessorClient;
import my.creativeaudit.app.collaborator.MediaToolkit;
import my.creativeaudit.app.collaborator.NoopAnalyticsWarehouseClient;
import my.creativeaudit.app.collaborator.NoopAnnotationClient;
import my.creativeaudit.app.collaborator.NoopChatNotifier;
import my.creativeaudit.app.collaborator.NoopContentUnderstandingClient;
import my.creativeaudit.app.collaborator.NoopMediaToolkit;
import my.creativeaudit.app.collaborator.NoopObjectStorageClient;
import my.creativeaudit.app.collaborator.NoopPaymentProcessorClient;
import my.creativeaudit.app.collaborator.ObjectStorageClient;
import my.creativeaudit.app.collaborator.PaymentProcessorClient;
import my.creativeaudit.app.collaborator.ResilientCaller;
import my.creativeaudit.app.collaborator.WebhookChatNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CollaboratorConfig {
	private static final Logger logger = LoggerFactory.getLogger(CollaboratorConfig.class);

	@Bean
	@ConditionalOnProperty(name = "app.collaborators.content-understanding.provider", havingValue = "http")
	public ContentUnderstandingClient httpContentUnderstandingClient(AppProperties properties,
																	 ResilientCaller caller,
																	 ObjectMapper objectMapper) {
		AppProperties.Endpoint endpoint = properties.collaborators().contentUnderstanding();
		logger.info("Content understanding enabled (provider=http, model={}).", endpoint.model());
		return new HttpContentUnderstandingClient(endpoint.baseUrl(), endpoint.apiKey(), endpoint.model(),
				connectTimeout(endpoint), readTimeout(endpoint), caller, CallPolicy.of(endpoint), objectMapper);
	}

	@Bean
	@ConditionalOnProperty(name = "app.collaborators.annotation.provider", havingValue = "http")
	public AnnotationClient httpAnnotationClient(AppProperties properties,
												 ResilientCaller caller,
												 ObjectMapper objectMapper) {
		AppProperties.Endpoint endpoint = properties.collaborators().annotation();
		logger.info("Annotation client enabled (provider=http).");
		return new HttpAnnotationClient(endpoint.baseUrl(), endpoint.apiKey(), connectTimeout(endpoint),
				readTimeout(endpoint), caller, CallPolicy.of(endpoint), objectMapper);
	}

	@Bean
	@ConditionalOnProperty(name = "app.collaborators.storage.provider", havingValue = "http")
	public ObjectStorageClient httpObjectStorageClient(AppProperties properties, ResilientCaller caller) {
		AppProperties.Endpoint endpoint = properties.collaborators().storage();
		logger.info("Object storage enabled (provider=http).");
		return new HttpObjectStorageClient(endpoint.baseUrl(), endpoint.apiKey(), connectTimeout(endpoint),
				readTimeout(endpoint), caller, CallPolicy.of(endpoint));
	}

	@Bean
	@ConditionalOnProperty(name = "app.collaborators.warehouse.provider", havingValue = "http")
	public AnalyticsWarehouseClient httpAnalyticsWarehouseClient(AppProperties properties) {
		AppProperties.Endpoint endpoint = properties.collaborators().warehouse();
		logger.info("Analytics warehouse enabled (provider=http, table={}).", endpoint.table());
		return new HttpAnalyticsWarehouseClient(endpoint.baseUrl(), endpoint.apiKey(), connectTimeout(endpoint),
				readTimeout(endpoint));
	}

	@Bean
	@ConditionalOnProperty(name = "app.collaborators.chat.provider", havingValue = "webhook")
	public ChatNotifier webhookChatNotifier(AppProperties properties) {
		logger.info("Chat notifications enabled (provider=webhook).");
		return new WebhookChatNotifier(properties.collaborators().chat().webhookUrl());
	}

	@Bean
	@ConditionalOnProperty(name = "app.collaborators.media.provider", havingValue = "ffmpeg")
	public MediaToolkit ffmpegMediaToolkit(AppProperties properties, ResilientCaller caller, ObjectMapper objectMapper) {
		AppProperties.Media media = properties.collaborators().media();
		int timeoutSeconds = media.callTimeoutSeconds() == null || media.callTimeoutSeconds() <= 0
				? 120
				: media.callTimeoutSeconds();
		logger.info("Media toolkit enabled (provider=ffmpeg).");
		return new FfmpegMediaToolkit(media.ffmpegPath(), media.ffprobePath(), caller,
				new CallPolicy(Duration.ofSeconds(timeoutSeconds), 0, 0L), objectMapper);
	}

	@Bean
	@ConditionalOnProperty(name = "app.billing.provider", havingValue = "http")
	public PaymentProcessorClient httpPaymentProcessorClient(AppProperties properties, ObjectMapper objectMapper) {
		logger.info("Payment processor enabled (provider=http).");
		return new HttpPaymentProcessorClient(properties.billing().baseUrl(), properties.billing().apiKey(), objectMapper);
	}

	@Bean
	@ConditionalOnMissingBean(ContentUnderstandingClient.class)
	public ContentUnderstandingClient noopContentUnderstandingClient() {
		logger.info("Content understanding disabled (provider=noop).");
		return new NoopContentUnderstandingClient();
	}

	@Bean
	@ConditionalOnMissingBean(AnnotationClient.class)
	public AnnotationClient noopAnnotationClient() {
		logger.info("Annotation client disabled (provider=noop).");
		return new NoopAnnotationClient();
	}

	@Bean
	@ConditionalOnMissingBean(ObjectStorageClient.class)
	public ObjectStorageClient noopObjectStorageClient() {
		logger.info("Object storage disabled (provider=noop).");
		return new NoopObjectStorageClient();
	}

	@Bean
	@ConditionalOnMissingBean(AnalyticsWarehouseClient.class)
	public AnalyticsWarehouseClient noopAnalyticsWarehouseClient() {
		return new NoopAnalyticsWarehouseClient();
	}

	@Bean
	@ConditionalOnMissingBean(ChatNotifier.class)
	public ChatNotifier noopChatNotifier() {
		return new NoopChatNotifier();
	}

	@Bean
	@ConditionalOnMissingBean(MediaToolkit.class)
	public MediaToolkit noopMediaToolkit() {
		logger.info("Media toolkit disabled (provider=noop).");
		return new NoopMediaToolkit();
	}

	@Bean
	@ConditionalOnMissingBean(PaymentProcessorClient.class)
	public PaymentProcessorClient noopPaymentProcessorClient() {
		logger.info("Payment processor disabled (provider=noop).");
		return new NoopPaymentProcessorClient();
	}

	private static Duration connectTimeout(AppProperties.Endpoint endpoint) {
		Integer seconds = endpoint.connectTimeoutSeconds();
		return Duration.ofSeconds(seconds == null || seconds <= 0 ? 10 : seconds);
	}

	private static Duration readTimeout(AppProperties.Endpoint endpoint) {
		Integer seconds = endpoint.readTimeoutSeconds();
		return Duration.ofSeconds(seconds == null || seconds <= 0 ? 120 : seconds);
	}
}
