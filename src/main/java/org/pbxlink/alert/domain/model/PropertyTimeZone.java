package org.pbxlink.alert.domain.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Time-zone record of a property: whole-hour UTC offset plus a zone table reference.
 */
@Entity
@Table(name = "property_time_zone")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertyTimeZone {

    @Id
    @Column(name = "property_id")
    private Long propertyId;

    @Column(name = "offset_hours")
    private Integer offsetHours;

    // IANA zone id, e.g. America/Chicago
    @Column(name = "zone_reference")
    private String zoneReference;
}
