package com.vuong.resthandler.sample;

import com.vuong.resthandler.core.domain.BaseEntity;
import jakarta.persistence.Entity;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter
@Setter
@NoArgsConstructor
public class Tag extends BaseEntity {

    private String name;

    public Tag(String name) {
        this.name = name;
    }
}
