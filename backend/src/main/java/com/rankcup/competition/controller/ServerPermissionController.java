package com.rankcup.competition.controller;

import com.rankcup.competition.dto.CompetitionRequests;
import com.rankcup.competition.dto.CompetitionResponses;
import com.rankcup.competition.mapper.CompetitionResponseMapper;
import com.rankcup.competition.model.PermissionType;
import com.rankcup.competition.model.ServerPermission;
import com.rankcup.competition.service.CompetitionPermissionService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/servers/{serverId}/permissions")
public class ServerPermissionController {

    private final CompetitionPermissionService competitionPermissionService;
    private final CompetitionResponseMapper competitionResponseMapper;

    public ServerPermissionController(
            CompetitionPermissionService competitionPermissionService,
            CompetitionResponseMapper competitionResponseMapper
    ) {
        this.competitionPermissionService = competitionPermissionService;
        this.competitionResponseMapper = competitionResponseMapper;
    }

    @PostMapping
    public ResponseEntity<CompetitionResponses.PermissionGrant> grantPermission(
            @PathVariable String serverId,
            @Valid @RequestBody CompetitionRequests.GrantPermissionRequest request
    ) {
        ServerPermission grant = competitionPermissionService.grantPermission(
                serverId,
                request.userId(),
                request.permission(),
                request.grantedBy()
        );
        return ResponseEntity.ok(competitionResponseMapper.toPermissionGrantResponse(grant));
    }

    @DeleteMapping("/{userId}/{permission}")
    public ResponseEntity<Void> revokePermission(
            @PathVariable String serverId,
            @PathVariable String userId,
            @PathVariable PermissionType permission
    ) {
        competitionPermissionService.revokePermission(serverId, userId, permission);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{userId}/can-create")
    public ResponseEntity<CompetitionResponses.CreationPermission> canCreateCompetition(
            @PathVariable String serverId,
            @PathVariable String userId,
            @RequestParam(defaultValue = "false") boolean administrator
    ) {
        CompetitionPermissionService.CreationPermission permission =
                competitionPermissionService.canCreateCompetition(serverId, userId, administrator);
        return ResponseEntity.ok(
                competitionResponseMapper.toCreationPermissionResponse(serverId, userId, permission)
        );
    }
}
