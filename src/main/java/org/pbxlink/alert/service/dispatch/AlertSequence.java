package org.pbxlink.alert.service.dispatch;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.stereotype.Component;

/**
 * Shared alert id generator backed by a database sequence: unique and increasing across
 * all service instances, with gaps allowed.
 */
@Component
public class AlertSequence {

    @PersistenceContext
    private EntityManager entityManager;

    public long next() {
        Number value = (Number) entityManager.createNativeQuery("SELECT nextval('alert_record_seq')")
                .getSingleResult();
        return value.longValue();
    }
}
