package com.projectledger.notification;

import com.projectledger.contract.ProjectEvent;
import com.projectledger.policy.PolicyEvaluator;
import com.projectledger.projection.Project;

public class PolicyExecutionHandler implements ProjectEventHandler {

    private final PolicyEvaluator policyEvaluator;

    public PolicyExecutionHandler(PolicyEvaluator policyEvaluator) {
        this.policyEvaluator = policyEvaluator;
    }

    @Override
    public boolean canHandle(ProjectEvent event) {
        return !event.isRejected();
    }

    @Override
    public void handle(ProjectEvent event, Project project) {
        policyEvaluator.evaluateAndExecute(event, project);
    }
}
