package com.scaffold.backend.modules.organization.presentation;

import java.net.URI;
import java.util.List;
import java.util.UUID;

import com.scaffold.backend.modules.organization.application.OrganizationService;
import com.scaffold.backend.modules.organization.presentation.dto.CreateOrganizationRequest;
import com.scaffold.backend.modules.organization.presentation.dto.OrganizationResponse;
import com.scaffold.backend.modules.organization.presentation.dto.UpdateOrganizationRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/organizations")
public class OrganizationController {

    private final OrganizationService organizationService;

    public OrganizationController(OrganizationService organizationService) {
        this.organizationService = organizationService;
    }

    @PostMapping
    public ResponseEntity<OrganizationResponse> create(@Valid @RequestBody CreateOrganizationRequest request) {
        OrganizationResponse created = organizationService.create(request);
        return ResponseEntity.created(URI.create("/organizations/" + created.id())).body(created);
    }

    @GetMapping
    public ResponseEntity<List<OrganizationResponse>> list() {
        return ResponseEntity.ok(organizationService.findAll());
    }

    @GetMapping("/{id}")
    public ResponseEntity<OrganizationResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(organizationService.findOne(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<OrganizationResponse> update(@PathVariable UUID id, @Valid @RequestBody UpdateOrganizationRequest request) {
        return ResponseEntity.ok(organizationService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        organizationService.remove(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/members/{userId}")
    public ResponseEntity<OrganizationResponse> addMember(@PathVariable UUID id, @PathVariable UUID userId) {
        return ResponseEntity.ok(organizationService.addMember(id, userId));
    }

    @DeleteMapping("/{id}/members/{userId}")
    public ResponseEntity<OrganizationResponse> removeMember(@PathVariable UUID id, @PathVariable UUID userId) {
        return ResponseEntity.ok(organizationService.removeMember(id, userId));
    }
}
