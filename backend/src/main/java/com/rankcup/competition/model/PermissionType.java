package com.rankcup.competition.model;

public enum PermissionType {
    CREATE_COMPETITION
}
