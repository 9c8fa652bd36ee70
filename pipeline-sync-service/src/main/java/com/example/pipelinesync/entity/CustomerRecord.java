package com.example.pipelinesync.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Entity
@Table(name = "st_customers",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_st_customers_tenant_source",
                        columnNames = {"tenant_id", "source_id"})
        })
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class CustomerRecord extends MirroredEntity {

    @Column(name = "name", length = 500)
    private String name;

    @Column(name = "customer_type", length = 50)
    private String customerType;

    @Column(name = "active")
    private Boolean active;
}
