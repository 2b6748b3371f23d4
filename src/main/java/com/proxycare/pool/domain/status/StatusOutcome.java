package com.proxycare.pool.domain.status;

import jakarta.persistence.*;
import lombok.*;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "statuses")
public class StatusOutcome {

    @Id
    @Column(name = "status_code", nullable = false)
    private Integer code;

    @Column(name = "short_description", nullable = false, unique = true, length = 300)
    private String shortDescription;

    public boolean isFailure() {
        return code != null && code >= 400;
    }
}
