package com.bmsedge.production.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Setter
@Getter
@Entity
@Table(name = "fabrics")
public class Fabric {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 255)
    @Column(name = "fabric_name", unique = true, nullable = false)
    private String name;

    @Size(max = 50)
    @Column(name = "fabric_code")
    private String code;

    @Size(max = 255)
    @Column(name = "short_name")
    private String shortName;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    public Fabric() {}

    public Fabric(String name, String code, String shortName) {
        this.name = name;
        this.code = code;
        this.shortName = shortName;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    public String getDisplayName() {
        if (shortName != null && !shortName.isBlank()) {
            return shortName;
        }
        return name;
    }
}
