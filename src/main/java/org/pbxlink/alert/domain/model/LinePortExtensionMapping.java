package org.pbxlink.alert.domain.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Maps a PBX line port to the property and extension it belongs to.
 */
@Entity
@Table(name = "line_port_extension_mapping")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LinePortExtensionMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "line_port", nullable = false, unique = true)
    private String linePort;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    @Column(nullable = false)
    private String extension;
}
