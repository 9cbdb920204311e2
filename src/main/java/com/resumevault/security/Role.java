package com.resumevault.security;

public enum Role {
    USER,
    ADMIN
}
