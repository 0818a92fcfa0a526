package org.evalux.landlord.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.evalux.landlord.dto.PlayerRequest;
import org.evalux.landlord.model.MatchSummary;
import org.evalux.landlord.model.Player;
import org.evalux.landlord.service.MatchService;
import org.evalux.landlord.service.PlayerService;
import org.evalux.landlord.service.StatisticsService;
import org.evalux.landlord.service.stats.PlayerStatistics;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/players")
@RequiredArgsConstructor
public class PlayerController {

    private final PlayerService playerService;
    private final MatchService matchService;
    private final StatisticsService statisticsService;

    @GetMapping
    public ResponseEntity<List<Player>> list() {
        return ResponseEntity.ok(playerService.list());
    }

    @PostMapping
    public ResponseEntity<Player> add(@Valid @RequestBody PlayerRequest req) {
        Player p = playerService.add(req.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(p);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        playerService.delete(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * Statistiques recalculées depuis tout l'historique du joueur.
     */
    @GetMapping("/{id}/statistics")
    public ResponseEntity<PlayerStatistics> statistics(@PathVariable Long id) {
        return ResponseEntity.ok(statisticsService.forPlayer(id));
    }

    @GetMapping("/{id}/matches")
    public ResponseEntity<List<MatchSummary>> matches(
            @PathVariable Long id,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(matchService.recentForPlayer(id, limit));
    }
}
