package org.pbxlink.alert.domain.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Channel switches for a property. A row without alert type is the property default;
 * a row with an alert type overrides the default for every channel whose flag is set.
 */
@Entity
@Table(name = "alert_channel_config",
        uniqueConstraints = @UniqueConstraint(columnNames = {"property_id", "alert_type"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertChannelConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    @Column(name = "alert_type")
    private Integer alertType;

    @Column(name = "email_enabled")
    private Boolean emailEnabled;

    @Column(name = "phone_enabled")
    private Boolean phoneEnabled;

    @Column(name = "sms_enabled")
    private Boolean smsEnabled;

    @Column(name = "popup_enabled")
    private Boolean popupEnabled;

    // semicolon-delimited recipient lists
    @Column(name = "email_recipients", columnDefinition = "TEXT")
    private String emailRecipients;

    @Column(name = "phone_numbers", columnDefinition = "TEXT")
    private String phoneNumbers;

    @Column(name = "sms_numbers", columnDefinition = "TEXT")
    private String smsNumbers;
}
