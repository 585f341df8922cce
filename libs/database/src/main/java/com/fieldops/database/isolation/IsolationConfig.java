package com.fieldops.database.isolation;

import com.fieldops.database.policy.PolicyCatalogInspector;
import com.fieldops.database.policy.RowPolicyCatalog;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import javax.sql.DataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the context propagator and the policy inspector over the application's pooled
 * {@link DataSource}, which must log in as the {@code ops_app} principal.
 *
 * <p>With {@code fieldops.isolation.verify-policies-on-startup=true} the application refuses to
 * start when the live row policies drift from {@link RowPolicyCatalog#standard()}.
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(IsolationProperties.class)
public class IsolationConfig {

    public static final String POLICY_VERIFIER_BEAN = "rowPolicyVerifier";

    @Bean
    @ConditionalOnMissingBean
    public RowPolicyCatalog rowPolicyCatalog() {
        return RowPolicyCatalog.standard();
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextPropagator contextPropagator(
            DataSource dataSource,
            IsolationProperties properties,
            ObjectProvider<MeterRegistry> meterRegistry) {
        return new ContextPropagator(
                dataSource, properties, meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyCatalogInspector policyCatalogInspector(
            DataSource dataSource, RowPolicyCatalog catalog) {
        return new PolicyCatalogInspector(dataSource, catalog);
    }

    @Bean(name = POLICY_VERIFIER_BEAN)
    @ConditionalOnProperty(
            prefix = "fieldops.isolation",
            name = "verify-policies-on-startup",
            havingValue = "true")
    public ApplicationRunner rowPolicyVerifier(PolicyCatalogInspector inspector) {
        return args -> inspector.inspect().throwIfInvalid();
    }
}
