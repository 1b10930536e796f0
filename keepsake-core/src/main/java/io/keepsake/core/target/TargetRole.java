package io.keepsake.core.target;

public enum TargetRole {
    PRIMARY,
    SECONDARY
}
