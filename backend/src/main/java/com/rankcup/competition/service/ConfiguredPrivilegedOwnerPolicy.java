package com.rankcup.competition.service;

import com.rankcup.competition.config.CompetitionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ConfiguredPrivilegedOwnerPolicy implements PrivilegedOwnerPolicy {

    private final CompetitionProperties competitionProperties;

    @Override
    public boolean isPrivilegedOwner(String ownerId) {
        return ownerId != null && competitionProperties.getPrivilegedOwnerIds().contains(ownerId);
    }
}
