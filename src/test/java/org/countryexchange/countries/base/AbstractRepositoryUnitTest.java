package org.countryexchange.countries.base;

import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * Base class for fast repository tests on an embedded H2 database.
 *
 * <p>The schema is generated from the entities instead of Flyway: the migrations use PostgreSQL
 * features H2 does not support. Upsert statements are PostgreSQL-only as well and are covered by
 * {@link AbstractRepositoryTest} subclasses.
 */
@DataJpaTest(
    properties = {"spring.flyway.enabled=false", "spring.jpa.hibernate.ddl-auto=create-drop"})
@ActiveProfiles("test")
public abstract class AbstractRepositoryUnitTest {}
