package com.cornerdetect.ANMS;

public enum AnmsVariant {
    BRUTE_FORCE,
    KD_TREE
}
