package io.jobplan4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobplan4j.Planner;
import io.jobplan4j.internal.json.ProblemJsonCodec;
import io.jobplan4j.service.SchedulingService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration entrypoint for jobplan4j components.
 */
@AutoConfiguration
@ConditionalOnClass(Planner.class)
@EnableConfigurationProperties(PlannerProperties.class)
@ConditionalOnProperty(prefix = "jobplan", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PlannerConfig {

    @Bean
    @ConditionalOnMissingBean
    public SchedulingService schedulingService(PlannerProperties props) {
        return new SchedulingService(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public PlannerLifecycle plannerLifecycle(SchedulingService schedulingService) {
        return new PlannerLifecycle(schedulingService);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProblemJsonCodec problemJsonCodec(ObjectProvider<ObjectMapper> objectMapperProvider) {
        return new ProblemJsonCodec(objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }
}
