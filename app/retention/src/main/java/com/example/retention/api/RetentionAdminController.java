/*
 * Where: Retention admin API
 * What: Lists policies and runs a cleanup or a purge round on demand
 * Why: Operators dry-run a policy or drain a backlog without waiting for the schedule
 */
package com.example.retention.api;

import com.example.retention.policy.RetentionPolicyRegistry;
import com.example.retention.service.CleanupResult;
import com.example.retention.service.PurgeRoundResult;
import com.example.retention.service.RetentionCleanupService;
import com.example.retention.service.RetentionPurgeService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/retention")
@RequiredArgsConstructor
public class RetentionAdminController {

  private final RetentionPolicyRegistry registry;
  private final RetentionCleanupService cleanupService;
  private final RetentionPurgeService purgeService;

  @GetMapping("/policies")
  public List<PolicySummary> policies() {
    return registry.policies().stream().map(PolicySummary::from).toList();
  }

  @PostMapping("/{entityType}/cleanup")
  public CleanupResult cleanup(
      @PathVariable("entityType") String entityType,
      @RequestParam(name = "dry_run", defaultValue = "false") boolean dryRun) {
    return cleanupService
        .cleanup(entityType, dryRun)
        .orElseThrow(() -> new PolicyNotFoundException(entityType));
  }

  @PostMapping("/rounds")
  public PurgeRoundResult runRound() {
    return purgeService.runBacklogRound(1);
  }
}
