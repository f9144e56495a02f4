package org.pbxlink.alert.domain.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Company directory entry for direct-integration partners: group + enterprise → property.
 */
@Entity
@Table(name = "directory_group_mapping")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DirectoryGroupMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "group_id", nullable = false)
    private String groupId;

    @Column(name = "enterprise_id")
    private String enterpriseId;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;
}
