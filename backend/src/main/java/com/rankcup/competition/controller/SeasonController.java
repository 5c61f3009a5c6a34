package com.rankcup.competition.controller;

import com.rankcup.competition.dto.CompetitionResponses;
import com.rankcup.competition.mapper.CompetitionResponseMapper;
import com.rankcup.competition.service.SeasonCalendar;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Seasons a SEASON competition may reference, newest first.
 */
@RestController
@RequestMapping("/api/seasons")
public class SeasonController {

    private final SeasonCalendar seasonCalendar;
    private final CompetitionResponseMapper competitionResponseMapper;

    public SeasonController(SeasonCalendar seasonCalendar, CompetitionResponseMapper competitionResponseMapper) {
        this.seasonCalendar = seasonCalendar;
        this.competitionResponseMapper = competitionResponseMapper;
    }

    @GetMapping
    public ResponseEntity<List<CompetitionResponses.Season>> listSeasons() {
        return ResponseEntity.ok(competitionResponseMapper.toSeasonResponses(seasonCalendar.listSeasons()));
    }
}
