package org.evalux.landlord.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.landlord.model.Player;
import org.evalux.landlord.repo.PlayerRepository;
import org.evalux.landlord.repo.RoundRecordRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.NoSuchElementException;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerService {
    private final PlayerRepository players;
    private final RoundRecordRepository rounds;

    public List<Player> list() {
        return players.findAllByOrderByNameAsc();
    }

    public Player get(Long id) {
        return players.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Joueur inconnu: " + id));
    }

    @Transactional
    public Player add(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) throw new IllegalArgumentException("Nom requis");
        if (players.existsByNameIgnoreCase(trimmed)) {
            throw new IllegalStateException("Un joueur porte déjà ce nom");
        }
        Player p = players.save(new Player(trimmed));
        log.info("Joueur créé: {} ({})", p.getName(), p.getId());
        return p;
    }

    // un joueur qui a un historique ne peut pas être supprimé (les stats des autres en dépendent)
    @Transactional
    public void delete(Long id) {
        Player p = get(id);
        if (rounds.existsByPlayerAIdOrPlayerBIdOrPlayerCId(id, id, id)) {
            throw new IllegalStateException("Ce joueur a déjà des manches enregistrées");
        }
        players.delete(p);
        log.info("Joueur supprimé: {} ({})", p.getName(), id);
    }
}
