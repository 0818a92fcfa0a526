package org.evalux.landlord.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerRequest {
    @NotBlank
    @Size(max = 60)
    private String name;
}
