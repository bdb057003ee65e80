package com.killradar.killfeed.parser;

import com.killradar.killfeed.identity.IdentityClient;
import com.killradar.killfeed.identity.IdentityKind;
import com.killradar.killfeed.identity.IdentityName;
import com.killradar.killfeed.model.Killmail;
import com.killradar.killfeed.model.Participant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fills in display names for the victim and the final-blow attacker.
 *
 * <p>Lossy by contract: every lookup is independent and a failed lookup leaves its field empty.
 * {@link #enrich} never throws and returns the input unchanged when nothing resolves.
 */
@Component
public class KillmailEnricher {
  private static final Logger log = LoggerFactory.getLogger(KillmailEnricher.class);

  private final IdentityClient identityClient;

  public KillmailEnricher(IdentityClient identityClient) {
    this.identityClient = identityClient;
  }

  public Killmail enrich(Killmail killmail) {
    try {
      Participant victim = killmail.victim() == null ? null : enrich(killmail.victim());
      Participant finalBlow = killmail.finalBlow() == null ? null : enrich(killmail.finalBlow());
      return killmail.withParticipants(victim, finalBlow);
    } catch (RuntimeException ex) {
      log.warn("Enrichment failed for killmail {}", killmail.killmailId(), ex);
      return killmail;
    }
  }

  private Participant enrich(Participant participant) {
    String characterName = participant.characterName() == null
        ? lookup(IdentityKind.CHARACTER, participant.characterId()).map(IdentityName::name).orElse(null)
        : null;

    String corporationTicker = null;
    String corporationName = null;
    if (participant.corporationTicker() == null || participant.corporationName() == null) {
      Optional<IdentityName> corporation = lookup(IdentityKind.CORPORATION, participant.corporationId());
      corporationTicker = corporation.map(IdentityName::ticker).orElse(null);
      corporationName = corporation.map(IdentityName::name).orElse(null);
    }

    String allianceTicker = null;
    String allianceName = null;
    if (participant.allianceTicker() == null || participant.allianceName() == null) {
      Optional<IdentityName> alliance = lookup(IdentityKind.ALLIANCE, participant.allianceId());
      allianceTicker = alliance.map(IdentityName::ticker).orElse(null);
      allianceName = alliance.map(IdentityName::name).orElse(null);
    }

    String shipName = participant.shipName() == null
        ? lookup(IdentityKind.SHIP_TYPE, participant.shipTypeId()).map(IdentityName::name).orElse(null)
        : null;

    return participant.withNames(
        characterName, corporationTicker, corporationName, allianceTicker, allianceName, shipName);
  }

  private Optional<IdentityName> lookup(IdentityKind kind, Long id) {
    if (id == null) {
      return Optional.empty();
    }
    try {
      return identityClient.lookup(kind, id);
    } catch (RuntimeException ex) {
      log.debug("{} lookup for {} raised {}", kind.cacheName(), id, ex.toString());
      return Optional.empty();
    }
  }
}
