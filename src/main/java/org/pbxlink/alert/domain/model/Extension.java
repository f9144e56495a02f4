package org.pbxlink.alert.domain.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Telephony endpoint of a property. Secondary extensions point at their primary.
 */
@Entity
@Table(name = "extension",
        uniqueConstraints = @UniqueConstraint(columnNames = {"property_id", "number"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Extension {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    @Column(nullable = false)
    private String number;

    private String name;

    @Column(name = "primary_number")
    private String primaryNumber;
}
