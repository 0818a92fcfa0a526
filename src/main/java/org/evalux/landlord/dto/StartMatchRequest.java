package org.evalux.landlord.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartMatchRequest {
    @NotNull
    private Long playerAId;
    @NotNull
    private Long playerBId;
    @NotNull
    private Long playerCId;

    // place qui annonce en premier à la manche 1 ; valeur de config si absente
    @Min(0) @Max(2)
    private Integer initialStarter;
}
