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
@Table(name = "work_center_mappings")
public class WorkCenterMapping {

    @Id
    @NotBlank
    @Size(max = 200)
    @Column(name = "work_center", length = 200)
    private String workCenter;

    @Column(name = "machine_id", nullable = false)
    private Long machineId;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public WorkCenterMapping() {}

    public WorkCenterMapping(String workCenter, Long machineId) {
        this.workCenter = workCenter;
        this.machineId = machineId;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }
}
