package my.creativeaudit.app.config;

import liquibase.integration.spring.SpringLiquibase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.support.DatabaseStartupValidator;

import javax.sql.DataSource;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Waits for the database, then applies the Liquibase changelog before JPA starts.
 */
@Configuration
public class DatabaseConfig {
	private static final Logger logger = LoggerFactory.getLogger(DatabaseConfig.class);

	@Bean
	public DatabaseStartupValidator databaseStartupValidator(DataSource dataSource, AppProperties properties) {
		AppProperties.Database database = properties.databaseOrDefault();
		DatabaseStartupValidator validator = new DatabaseStartupValidator();
		validator.setDataSource(dataSource);
		validator.setTimeout(database.startupTimeoutSecondsOrDefault());
		validator.setInterval(database.startupIntervalSecondsOrDefault());
		return validator;
	}

	@Bean
	@DependsOn("databaseStartupValidator")
	public SpringLiquibase liquibase(DataSource dataSource, AppProperties properties) {
		AppProperties.Database database = properties.databaseOrDefault();
		SpringLiquibase liquibase = new SpringLiquibase();
		liquibase.setDataSource(dataSource);
		liquibase.setChangeLog(database.changeLogOrDefault());
		liquibase.setShouldRun(database.migrateOrDefault());
		logger.info("Schema migration {} (changelog={}).", database.migrateOrDefault() ? "enabled" : "disabled",
				database.changeLogOrDefault());
		return liquibase;
	}

	@Bean
	public static BeanFactoryPostProcessor liquibaseBeforeJpaPostProcessor() {
		return beanFactory -> {
			addDependency(beanFactory, "entityManagerFactory", "liquibase");
			addDependency(beanFactory, "jpaSharedEM_entityManagerFactory", "liquibase");
		};
	}

	private static void addDependency(ConfigurableListableBeanFactory beanFactory, String beanName, String dependency) {
		if (!beanFactory.containsBeanDefinition(beanName)) {
			return;
		}
		BeanDefinition definition = beanFactory.getBeanDefinition(beanName);
		Set<String> dependsOn = new LinkedHashSet<>();
		if (definition.getDependsOn() != null) {
			dependsOn.addAll(Arrays.asList(definition.getDependsOn()));
		}
		dependsOn.add(dependency);
		definition.setDependsOn(dependsOn.toArray(new String[0]));
	}
}
