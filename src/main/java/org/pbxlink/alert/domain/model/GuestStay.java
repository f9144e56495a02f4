package org.pbxlink.alert.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Guest occupancy of a room. A stay without check-out is current.
 */
@Entity
@Table(name = "guest_stay")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GuestStay {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    @Column(name = "room_number", nullable = false)
    private String roomNumber;

    @Column(name = "guest_id", nullable = false)
    private String guestId;

    @Column(name = "guest_name", nullable = false)
    private String guestName;

    @Column(name = "checked_in_at", nullable = false)
    private LocalDateTime checkedInAt;

    @Column(name = "checked_out_at")
    private LocalDateTime checkedOutAt;
}
