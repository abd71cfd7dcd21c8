package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "material_definition")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MaterialDefinition {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 500)
    private String description;
}
