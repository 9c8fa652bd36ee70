package com.example.pipelinesync.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Entity
@Table(name = "st_business_units",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_st_business_units_tenant_source",
                        columnNames = {"tenant_id", "source_id"})
        })
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class BusinessUnitRecord extends MirroredEntity {

    @Column(name = "name")
    private String name;

    @Column(name = "active")
    private Boolean active;
}
