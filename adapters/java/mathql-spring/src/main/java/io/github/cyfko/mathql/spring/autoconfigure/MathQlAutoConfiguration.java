package io.github.cyfko.mathql.spring.autoconfigure;

import io.github.cyfko.mathql.core.api.ExpressionEngine;
import io.github.cyfko.mathql.core.channel.MathChannelHistory;
import io.github.cyfko.mathql.core.config.EnginePolicy;
import io.github.cyfko.mathql.core.impl.BasicExpressionEngine;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnClass(ExpressionEngine.class)
@EnableConfigurationProperties(MathQlProperties.class)
public class MathQlAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public EnginePolicy mathQlEnginePolicy(MathQlProperties properties) {
        return properties.toEnginePolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpressionEngine expressionEngine(EnginePolicy enginePolicy) {
        return new BasicExpressionEngine(enginePolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    public MathChannelHistory mathChannelHistory(ExpressionEngine expressionEngine, MathQlProperties properties) {
        return new MathChannelHistory(expressionEngine, properties.getHistoryLimit());
    }
}
