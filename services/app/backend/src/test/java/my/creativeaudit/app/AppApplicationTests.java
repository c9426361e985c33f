package my.creativeaudit.app;

import my.creativeaudit.app.rubric.RubricCatalog;
import my.creativeaudit.app.service.StaleJobReaper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = AppApplication.class)
@ActiveProfiles("test")
class AppApplicationTests {

	private static final String JWT_SECRET = UUID.randomUUID().toString();

	@Autowired
	private ApplicationContext context;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		registry.add("app.jwt.secret", () -> JWT_SECRET);
		registry.add("app.jwt.issuer", () -> "test-issuer");
	}

	@Test
	void contextLoads() {
		assertThat(context.getBean(RubricCatalog.class).all()).isNotEmpty();
		assertThat(context.getBeanNamesForType(StaleJobReaper.class)).isEmpty();
	}
}
