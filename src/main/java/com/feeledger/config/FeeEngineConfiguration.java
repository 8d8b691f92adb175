package com.feeledger.config;

import com.feeledger.engine.FeeCalculationEngine;
import com.feeledger.policy.CachingPolicyLoader;
import com.feeledger.policy.FeePolicy;
import com.feeledger.policy.InMemoryPolicyRepository;
import com.feeledger.policy.PolicyCache;
import com.feeledger.policy.PolicyDocumentReader;
import com.feeledger.policy.PolicyHasher;
import com.feeledger.policy.PolicyLoader;
import com.feeledger.policy.PolicyValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

@Configuration
public class FeeEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FeeEngineConfiguration.class);

    @Bean
    public PolicyDocumentReader policyDocumentReader(PolicyValidator validator, FeeLedgerProperties properties) {
        return new PolicyDocumentReader(validator, properties.getDefaultPrecision());
    }

    /**
     * Repository seeded from {@code feeledger.policies}. A document that fails
     * to parse or validate stops start-up.
     */
    @Bean
    public InMemoryPolicyRepository policyRepository(PolicyValidator validator,
                                                     PolicyDocumentReader reader,
                                                     FeeLedgerProperties properties,
                                                     ResourcePatternResolver resolver) {
        InMemoryPolicyRepository repository = new InMemoryPolicyRepository(validator);
        for (String location : properties.getPolicies()) {
            for (Resource resource : resources(resolver, location)) {
                List<FeePolicy> policies = read(reader, resource);
                policies.forEach(repository::register);
                log.info("Loaded {} fee policies from {}", policies.size(), resource.getDescription());
            }
        }
        return repository;
    }

    @Bean
    public PolicyCache policyCache(FeeLedgerProperties properties) {
        return new PolicyCache(properties.getPolicyCache().getMaxEntries());
    }

    @Bean
    @Primary
    public PolicyLoader policyLoader(InMemoryPolicyRepository repository, PolicyCache cache,
                                     FeeLedgerProperties properties) {
        if (!properties.getPolicyCache().isEnabled()) {
            return repository;
        }
        return new CachingPolicyLoader(repository, cache);
    }

    @Bean
    public FeeCalculationEngine feeCalculationEngine(PolicyValidator validator, PolicyHasher hasher) {
        return new FeeCalculationEngine(validator, hasher);
    }

    private static Resource[] resources(ResourcePatternResolver resolver, String location) {
        try {
            return resolver.getResources(location);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot resolve policy location " + location, ex);
        }
    }

    private static List<FeePolicy> read(PolicyDocumentReader reader, Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return reader.readAll(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read policy document " + resource.getDescription(), ex);
        }
    }
}
