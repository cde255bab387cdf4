package com.openforge.tutor.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Activates Spring Data JPA Auditing so that @CreatedDate / @LastModifiedDate
 * on BaseEntity are populated on every insert and update.  Interaction history
 * and the correction queue are both ordered by create_time.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
