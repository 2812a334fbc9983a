package com.PayRecon.recon_backend.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "pay_comp_code_mappings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayCompCodeMapping {

    @Id
    @Column(length = 50)
    private String payCompCode;

    @Column(nullable = false, length = 50)
    private String glAccount;

    private String glName;
}
