package org.pbxlink.alert.domain.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Named configuration value scoped to a property. Property id 0 holds the global defaults.
 */
@Entity
@Table(name = "property_parameter",
        uniqueConstraints = @UniqueConstraint(columnNames = {"property_id", "name"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertyParameter {

    public static final long GLOBAL_PROPERTY_ID = 0L;

    public static final String EXEMPT_NUMBERS = "EMERGENCY_EXEMPT_NUMBERS";
    public static final String TIME_DIFFERENCE_HOURS = "TIME_DIFFERENCE_HOURS";
    public static final String EVENT_SUBSCRIBE = "EMERGENCY_EVENT_SUBSCRIBE";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    @Column(nullable = false)
    private String name;

    @Column(name = "value", columnDefinition = "TEXT")
    private String value;
}
