package org.pbxlink.alert.domain.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Partner-gateway attribute of a property. The enterprise code may hold a
 * semicolon-delimited list; the first entry is the primary code.
 */
@Entity
@Table(name = "partner_attribute")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PartnerAttribute {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    @Column(nullable = false)
    private String partner;

    @Column(name = "enterprise_code")
    private String enterpriseCode;

    public String primaryEnterpriseCode() {
        if (enterpriseCode == null) {
            return null;
        }
        int separator = enterpriseCode.indexOf(';');
        return (separator >= 0 ? enterpriseCode.substring(0, separator) : enterpriseCode).trim();
    }
}
