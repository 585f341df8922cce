package com.fieldops.database.isolation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.fieldops.database.policy.PolicyCatalogInspector;
import com.fieldops.database.policy.RowPolicyCatalog;
import java.time.Duration;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

@DisplayName("IsolationConfig")
class IsolationConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(IsolationConfig.class));

    @Test
    @DisplayName("exposes the propagator, catalog and inspector over the application DataSource")
    void beans() {
        runner.withBean(DataSource.class, () -> mock(DataSource.class))
                .run(context -> {
                    assertThat(context).hasSingleBean(ContextPropagator.class);
                    assertThat(context).hasSingleBean(PolicyCatalogInspector.class);
                    assertThat(context.getBean(RowPolicyCatalog.class)).isSameAs(RowPolicyCatalog.standard());
                    assertThat(context).doesNotHaveBean(IsolationConfig.POLICY_VERIFIER_BEAN);
                });
    }

    @Test
    @DisplayName("backs off without a DataSource")
    void noDataSource() {
        runner.run(context -> assertThat(context).doesNotHaveBean(ContextPropagator.class));
    }

    @Test
    @DisplayName("binds fieldops.isolation properties")
    void bindsProperties() {
        runner.withBean(DataSource.class, () -> mock(DataSource.class))
                .withPropertyValues(
                        "fieldops.isolation.statement-timeout=2s",
                        "fieldops.isolation.max-attempts=5")
                .run(context -> {
                    IsolationProperties properties = context.getBean(IsolationProperties.class);
                    assertThat(properties.statementTimeout()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(properties.maxAttempts()).isEqualTo(5);
                    assertThat(properties.trustedServiceEnabled()).isFalse();
                });
    }

    @Test
    @DisplayName("rejects an attempt count outside 1-10")
    void validatesAttempts() {
        runner.withBean(DataSource.class, () -> mock(DataSource.class))
                .withPropertyValues("fieldops.isolation.max-attempts=20")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("registers the start-up policy verifier when requested")
    void startupVerifier() {
        runner.withBean(DataSource.class, () -> mock(DataSource.class))
                .withPropertyValues("fieldops.isolation.verify-policies-on-startup=true")
                .run(context -> assertThat(context).hasBean(IsolationConfig.POLICY_VERIFIER_BEAN));
    }
}
