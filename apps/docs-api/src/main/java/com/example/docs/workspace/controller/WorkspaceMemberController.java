package com.example.docs.workspace.controller;

import com.example.docs.access.model.MethodClass;
import com.example.docs.access.service.ResourceAuthorizationService;
import com.example.docs.common.util.StringSanitizer;
import com.example.docs.security.annotation.ResolvedAuth;
import com.example.docs.security.context.AuthContext;
import com.example.docs.security.exception.AuthorizationException;
import com.example.docs.workspace.model.response.WorkspaceMemberResponse;
import com.example.docs.workspace.service.WorkspaceMembershipService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/workspaces/{slug}/members")
@RequiredArgsConstructor
public class WorkspaceMemberController {

    private final ResourceAuthorizationService authorizationService;
    private final WorkspaceMembershipService membershipService;

    @GetMapping
    public Flux<WorkspaceMemberResponse> listMembers(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            ServerHttpRequest request) {

        return authorizationService.requireMembership(auth, slug, MethodClass.SAFE, request)
                .flatMapMany(membership -> membershipService.listActiveMembers(membership.workspaceId()))
                .map(WorkspaceMemberResponse::from);
    }

    @DeleteMapping("/{memberId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deactivateMember(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String memberId,
            ServerHttpRequest request) {

        log.debug("DELETE /members/{} - user: {}",
                StringSanitizer.forLog(memberId), StringSanitizer.forLog(auth.userId()));
        return authorizationService.requireMembership(auth, slug, MethodClass.MUTATING, request)
                .flatMap(membership -> {
                    if (!membership.isAdmin()) {
                        return Mono.error(new AuthorizationException("Only workspace admins can remove members"));
                    }
                    if (membership.userId().equals(memberId)) {
                        return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                                "Admins cannot deactivate themselves"));
                    }
                    return membershipService.deactivate(membership.workspaceId(), memberId);
                })
                .then();
    }
}
