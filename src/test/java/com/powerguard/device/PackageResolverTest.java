package com.powerguard.device;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class PackageResolverTest {

    private ScriptedDeviceShell shell;
    private PackageResolver resolver;

    @BeforeEach
    void setUp() {
        shell = new ScriptedDeviceShell();
        resolver = new PackageResolver(shell);
    }

    @Test
    @DisplayName("uidOf picks the exact package, not one that merely contains the name")
    void uidOfExactMatch() {
        shell.respond("cmd package list packages -U com.example.app", 0, """
                package:com.example.app.helper uid:10200
                package:com.example.app uid:10123
                """);

        assertEquals(OptionalInt.of(10123), resolver.uidOf("com.example.app"));
    }

    @Test
    @DisplayName("uidOf is empty for a package that is not installed")
    void uidOfMissing() {
        shell.respond("cmd package list packages -U", 0, "");

        assertTrue(resolver.uidOf("com.example.gone").isEmpty());
    }

    @Test
    @DisplayName("pidsOf parses pidof output and tolerates no match")
    void pidsOf() {
        shell.respond("pidof com.example.app", 0, "4321 4400");
        shell.respond("pidof com.example.idle", 1, "");

        assertEquals(List.of(4321, 4400), resolver.pidsOf("com.example.app"));
        assertTrue(resolver.pidsOf("com.example.idle").isEmpty());
    }

    @Test
    @DisplayName("only package-style names are accepted")
    void packageNameValidation() {
        assertTrue(PackageResolver.isValidPackageName("com.example.app"));
        assertTrue(PackageResolver.isValidPackageName("com.example_2.App"));
        assertFalse(PackageResolver.isValidPackageName("example"));
        assertFalse(PackageResolver.isValidPackageName("com.example; reboot"));
        assertFalse(PackageResolver.isValidPackageName("com.example.app && rm -rf /"));
        assertFalse(PackageResolver.isValidPackageName(null));
    }
}
