package org.evalux.landlord.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.evalux.landlord.dto.MatchView;
import org.evalux.landlord.dto.RoundRequest;
import org.evalux.landlord.service.MatchService;
import org.evalux.landlord.service.RoundService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Saisie et correction des manches. Chaque réponse renvoie le match complet recalculé.
 */
@RestController
@RequestMapping("/api/matches/{matchId}/rounds")
@RequiredArgsConstructor
public class RoundController {

    private final RoundService roundService;
    private final MatchService matchService;

    @PostMapping
    public ResponseEntity<MatchView> record(@PathVariable Long matchId, @Valid @RequestBody RoundRequest req) {
        roundService.record(matchId, req.toInput());
        return ResponseEntity.status(HttpStatus.CREATED).body(matchService.view(matchId));
    }

    @PutMapping("/{index}")
    public ResponseEntity<MatchView> edit(@PathVariable Long matchId,
                                          @PathVariable int index,
                                          @Valid @RequestBody RoundRequest req) {
        roundService.edit(matchId, index, req.toInput());
        return ResponseEntity.ok(matchService.view(matchId));
    }

    @DeleteMapping("/{index}")
    public ResponseEntity<Void> delete(@PathVariable Long matchId, @PathVariable int index) {
        roundService.delete(matchId, index);
        return ResponseEntity.noContent().build();
    }
}
