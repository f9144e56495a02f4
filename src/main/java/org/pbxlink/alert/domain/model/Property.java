package org.pbxlink.alert.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.pbxlink.alert.domain.model.enums.PbxIntegrationType;

/**
 * A managed site (hotel, residence) that owns extensions, rooms and alert configuration.
 * The id is the legacy company number.
 */
@Entity
@Table(name = "property")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Property {

    @Id
    private Long id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "pbx_integration_type", nullable = false)
    @Builder.Default
    private PbxIntegrationType pbxIntegrationType = PbxIntegrationType.NONE;

    /**
     * True for properties that predate structured PBX management.
     */
    @Column(nullable = false)
    @Builder.Default
    private boolean legacy = false;
}
