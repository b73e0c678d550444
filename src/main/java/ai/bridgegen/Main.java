package ai.bridgegen;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import ai.bridgegen.ast.RawAst;
import ai.bridgegen.convert.BridgeConverter;
import ai.bridgegen.convert.ConversionConfig;
import ai.bridgegen.convert.ConversionResult;
import ai.bridgegen.convert.ConvertException;
import ai.bridgegen.io.BindingsReader;
import ai.bridgegen.io.BridgeWriter;
import ai.bridgegen.model.QualifiedName;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path bindingsFile = null;
        Path outDir = null;
        Path configFile = null;
        Path podFile = null;
        String extraInclude = null;
        Boolean oldRust = null;
        final List<String> includes = new ArrayList<>();
        final Set<String> podRequests = new LinkedHashSet<>();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--outDir=")) {
                    outDir = Paths.get(arg.substring("--outDir=".length()));
                    continue;
                }
                if (arg.startsWith("--config=")) {
                    configFile = Paths.get(arg.substring("--config=".length()));
                    continue;
                }
                if (arg.startsWith("--include=")) {
                    splitList(arg.substring("--include=".length()), includes);
                    continue;
                }
                if (arg.startsWith("--extraInclude=")) {
                    extraInclude = arg.substring("--extraInclude=".length()).trim();
                    continue;
                }
                if (arg.startsWith("--pod=")) {
                    final List<String> names = new ArrayList<>();
                    splitList(arg.substring("--pod=".length()), names);
                    podRequests.addAll(names);
                    continue;
                }
                if (arg.startsWith("--podFile=")) {
                    podFile = Paths.get(arg.substring("--podFile=".length()));
                    continue;
                }
                if (arg.startsWith("--oldRust=")) {
                    oldRust = Boolean.parseBoolean(arg.substring("--oldRust=".length()));
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (bindingsFile == null) {
                    bindingsFile = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (bindingsFile == null) {
                System.err.println("ERROR: missing bindings file");
                printUsage();
                return 2;
            }
            bindingsFile = bindingsFile.toAbsolutePath().normalize();
            final Path baseDir = bindingsFile.getParent();

            final BindingsReader reader = new BindingsReader();

            // config file first; command line values are added on top
            ConversionConfig base = new ConversionConfig(List.of(), List.of(), false);
            if (configFile != null) {
                final var cf = reader.readConfig(resolve(baseDir, configFile));
                base = cf.toConversionConfig();
                if (extraInclude == null) {
                    extraInclude = cf.extraInclude();
                }
            }
            if (podFile != null) {
                loadPodRequestsFromFile(resolve(baseDir, podFile), podRequests);
            }

            final List<String> allIncludes = new ArrayList<>(base.includeList());
            allIncludes.addAll(includes);
            final List<QualifiedName> allPods = new ArrayList<>(base.podRequests());
            for (String p : podRequests) {
                final QualifiedName qn = QualifiedName.of(p);
                if (!allPods.contains(qn)) {
                    allPods.add(qn);
                }
            }
            final ConversionConfig config = new ConversionConfig(
                    allIncludes, allPods, oldRust != null ? oldRust : base.oldRust());

            if (outDir == null) {
                outDir = baseDir.resolve("bridge-out");
            } else if (!outDir.isAbsolute()) {
                outDir = baseDir.resolve(outDir).normalize();
            }

            final RawAst.Module bindings = reader.readModule(bindingsFile);
            final ConversionResult result = new BridgeConverter(config).convert(bindings, extraInclude);

            final BridgeWriter writer = new BridgeWriter(outDir);
            writer.writeAll(result, Instant.now().toString());

            System.out.println("Bridge written to: " + outDir);
            System.out.println("Schema: " + BridgeWriter.SCHEMA_VERSION);
            System.out.println("Types: " + result.typesToDisable().size()
                    + ", additional needs: " + result.additionalNeeds().size());
            return 0;
        } catch (ConvertException ex) {
            System.err.println("ERROR: conversion failed (" + ex.kind() + "): " + safeMsg(ex.getMessage()));
            return 1;
        } catch (java.io.IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to convert bindings: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static Path resolve(Path baseDir, Path p) {
        return p.isAbsolute() ? p : baseDir.resolve(p).normalize();
    }

    private static void splitList(String list, List<String> out) {
        final String trimmed = list.trim();
        if (!trimmed.isEmpty()) {
            Arrays.stream(trimmed.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(out::add);
        }
    }

    private static void loadPodRequestsFromFile(Path podFile, Set<String> podRequests) throws java.io.IOException {
        if (!Files.isRegularFile(podFile)) {
            throw new java.io.IOException("POD request file not found: " + podFile);
        }
        try (var br = Files.newBufferedReader(podFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                final int hash = trimmed.indexOf('#');
                if (hash >= 0) {
                    trimmed = trimmed.substring(0, hash).trim();
                }
                if (trimmed.isEmpty()) {
                    continue;
                }
                for (String token : trimmed.split("[,\\s]+")) {
                    final String t = token.trim();
                    if (!t.isEmpty()) {
                        podRequests.add(t);
                    }
                }
            }
        }
    }

    private static void printUsage() {
        System.out.println("Usage: bridge-gen <bindings.json> [options]");
        System.out.println("Options:");
        System.out.println("  --outDir=<path>         Output directory (default: <bindings dir>/bridge-out)");
        System.out.println("  --config=<path>         JSON config (includes, podRequests, oldRust, extraInclude)");
        System.out.println("  --include=<h1,h2>       Headers to include, after those from the config");
        System.out.println("  --extraInclude=<h>      Header included after all others");
        System.out.println("  --pod=<T1,T2>           Types to pass by value");
        System.out.println("  --podFile=<path>        File of types to pass by value (one per line or comma-separated)");
        System.out.println("  --oldRust=<bool>        Omit native type declarations (default: false)");
        System.out.println("  --help, -h              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
