package com.rankcup.competition.service;

/**
 * Decides which owners are exempt from the active-competition caps.
 */
public interface PrivilegedOwnerPolicy {

    boolean isPrivilegedOwner(String ownerId);
}
