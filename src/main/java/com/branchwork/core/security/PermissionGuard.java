package com.branchwork.core.security;

import com.branchwork.core.result.ErrorCode;
import com.branchwork.core.result.Result;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Objects;

/**
 * Decides whether an operation is permitted under a permission level.
 * Stateless; every method is a pure function of its arguments.
 */
@Service
public class PermissionGuard {

    public boolean isAllowed(PermissionLevel level, OperationKind operation) {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(operation, "operation");
        return switch (level) {
            case ISOLATED -> operation == OperationKind.READ_ONLY;
            case SANDBOXED -> operation != OperationKind.UNRESTRICTED;
            case TRUSTED -> true;
        };
    }

    /**
     * Lowest level under which {@code operation} is allowed.
     */
    public PermissionLevel requiredLevel(OperationKind operation) {
        return switch (operation) {
            case READ_ONLY -> PermissionLevel.ISOLATED;
            case SCOPED_WRITE -> PermissionLevel.SANDBOXED;
            case UNRESTRICTED -> PermissionLevel.TRUSTED;
        };
    }

    /**
     * Checks every operation against {@code level}, failing on the first one that is not allowed.
     */
    public Result<Void> authorize(PermissionLevel level, Collection<OperationKind> operations) {
        for (OperationKind operation : operations) {
            if (!isAllowed(level, operation)) {
                return Result.failure(ErrorCode.PERMISSION_DENIED,
                        "Operation " + operation + " requires " + requiredLevel(operation)
                                + " but agent level is " + level);
            }
        }
        return Result.ok();
    }

    /**
     * True when {@code target}, resolved against {@code scope} if relative, stays inside {@code scope}.
     * Used to confine {@link OperationKind#SCOPED_WRITE} for sandboxed agents.
     */
    public boolean isWithinScope(Path scope, Path target) {
        Path root = scope.toAbsolutePath().normalize();
        Path resolved = root.resolve(target).normalize();
        return resolved.startsWith(root);
    }
}
