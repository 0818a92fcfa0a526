package org.evalux.landlord.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.evalux.landlord.dto.MatchView;
import org.evalux.landlord.dto.StartMatchRequest;
import org.evalux.landlord.model.MatchSummary;
import org.evalux.landlord.service.MatchService;
import org.evalux.landlord.service.stats.PlayerStatistics;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/matches")
@RequiredArgsConstructor
public class MatchController {

    private final MatchService matchService;

    @PostMapping
    public ResponseEntity<MatchSummary> start(@Valid @RequestBody StartMatchRequest req) {
        MatchSummary m = matchService.start(req.getPlayerAId(), req.getPlayerBId(), req.getPlayerCId(), req.getInitialStarter());
        return ResponseEntity.status(HttpStatus.CREATED).body(m);
    }

    // plus récents d'abord
    @GetMapping
    public ResponseEntity<List<MatchSummary>> list(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(matchService.recent(limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<MatchView> get(@PathVariable Long id) {
        return ResponseEntity.ok(matchService.view(id));
    }

    // une entrée par place (A, B, C), calculée sur les seules manches du match
    @GetMapping("/{id}/statistics")
    public ResponseEntity<List<PlayerStatistics>> statistics(@PathVariable Long id) {
        return ResponseEntity.ok(matchService.statistics(id));
    }

    @GetMapping("/{id}/next-bidder")
    public ResponseEntity<?> nextBidder(@PathVariable Long id) {
        return ResponseEntity.ok(Map.of("seat", matchService.nextBidder(id)));
    }

    /**
     * Termine le match. 204 si le match était vide (il est alors supprimé).
     */
    @PostMapping("/{id}/end")
    public ResponseEntity<MatchSummary> end(@PathVariable Long id) {
        Optional<MatchSummary> ended = matchService.end(id);
        return ended.map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        matchService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
