package com.PayRecon.recon_backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "journal_description_mappings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JournalDescriptionMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String description;

    @Column(length = 50)
    private String glAccount;

    @Builder.Default
    private boolean includeInTotalCost = true;

    @Builder.Default
    private boolean active = true;
}
