package com.example.roster.domain.model;

/**
 * Kind of main committee as implied by its printed name.
 */
public enum CommitteeType {
    STANDING,
    SELECT,
    JOINT
}
