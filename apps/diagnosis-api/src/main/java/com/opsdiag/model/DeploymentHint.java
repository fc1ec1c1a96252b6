package com.opsdiag.model;

public record DeploymentHint(String commit, String repository, String service) {
}
