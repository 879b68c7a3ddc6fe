package com.scaffold.backend.modules.rbac.domain;

public record GrantedPermission(String resource, String action) {

    public static GrantedPermission from(Permission permission) {
        return new GrantedPermission(permission.getResource(), permission.getAction());
    }

    public boolean matches(PermissionName name) {
        return resource.equals(name.resource()) && action.equals(name.action());
    }

    public String name() {
        return resource + ":" + action;
    }
}
