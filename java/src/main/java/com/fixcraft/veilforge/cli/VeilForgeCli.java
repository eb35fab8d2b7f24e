package com.fixcraft.veilforge.cli;

import com.fixcraft.veilforge.CarrierType;
import com.fixcraft.veilforge.ContentType;
import com.fixcraft.veilforge.ExtractedPayload;
import com.fixcraft.veilforge.HideOptions;
import com.fixcraft.veilforge.KdfParams;
import com.fixcraft.veilforge.Redundancy;
import com.fixcraft.veilforge.StegoException;
import com.fixcraft.veilforge.StegoLog;
import com.fixcraft.veilforge.VeilForge;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class VeilForgeCli {
    private static final class GlobalOptions {
        final boolean verbose;
        final boolean noLog;
        final String[] args;

        GlobalOptions(boolean verbose, boolean noLog, String[] args) {
            this.verbose = verbose;
            this.noLog = noLog;
            this.args = args;
        }
    }

    /** Positional arguments plus {@code --name value} options. */
    private static final class CommandArgs {
        final List<String> positional = new ArrayList<>();
        final Map<String, String> options = new HashMap<>();

        String option(String name) {
            return options.get(name);
        }
    }

    private VeilForgeCli() {}

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args == null || args.length == 0) {
            usage(out);
            return 2;
        }
        GlobalOptions globals = parseGlobalOptions(args);
        StegoLog.configureFromCli(globals.verbose, globals.noLog);
        args = globals.args;
        if (args.length == 0) {
            usage(out);
            return 2;
        }
        String command = args[0];
        try {
            CommandArgs parsed = parseCommandArgs(args);
            List<String> pos = parsed.positional;
            switch (command) {
                case "hide": {
                    if (pos.size() < 3) {
                        usage(out);
                        return 2;
                    }
                    File carrier = new File(pos.get(0));
                    File payload = new File(pos.get(1));
                    byte[] carrierBytes = readAllBytes(carrier);
                    CarrierType type = carrierType(parsed, carrier, carrierBytes);
                    StegoLog.info("[veilforge] hide " + payload.getName() + " in " + type.tag() + " " + carrier.getName());
                    byte[] result = VeilForge.hide(carrierBytes, type, readAllBytes(payload), payload.getName(),
                        parsed.option("password"), hideOptions(parsed));
                    writeAllBytes(new File(pos.get(2)), result);
                    out.println("Hidden " + payload.length() + " bytes in " + pos.get(2));
                    return 0;
                }
                case "hide-text": {
                    if (pos.size() < 3) {
                        usage(out);
                        return 2;
                    }
                    File carrier = new File(pos.get(0));
                    byte[] carrierBytes = readAllBytes(carrier);
                    CarrierType type = carrierType(parsed, carrier, carrierBytes);
                    StegoLog.info("[veilforge] hide text in " + type.tag() + " " + carrier.getName());
                    byte[] result = VeilForge.hideText(carrierBytes, type, pos.get(1), parsed.option("password"),
                        hideOptions(parsed));
                    writeAllBytes(new File(pos.get(2)), result);
                    out.println("Hidden text in " + pos.get(2));
                    return 0;
                }
                case "extract": {
                    if (pos.isEmpty()) {
                        usage(out);
                        return 2;
                    }
                    File carrier = new File(pos.get(0));
                    byte[] carrierBytes = readAllBytes(carrier);
                    ExtractedPayload extracted = VeilForge.extract(carrierBytes,
                        carrierType(parsed, carrier, carrierBytes), parsed.option("password"));
                    if (extracted.contentType() == ContentType.TEXT && parsed.option("out") == null) {
                        out.println(extracted.text());
                        return 0;
                    }
                    File target = outputFor(parsed.option("out"), extracted);
                    writeAllBytes(target, extracted.payload());
                    out.println("Extracted " + extracted.payload().length + " bytes to " + target.getPath());
                    return 0;
                }
                case "capacity": {
                    if (pos.isEmpty()) {
                        usage(out);
                        return 2;
                    }
                    File carrier = new File(pos.get(0));
                    byte[] carrierBytes = readAllBytes(carrier);
                    CarrierType type = carrierType(parsed, carrier, carrierBytes);
                    String rawFactor = parsed.option("redundancy");
                    int factor = rawFactor == null ? type.redundancyFloor() : Redundancy.parse(rawFactor).factor();
                    if (factor < 1) {
                        factor = type.redundancyFloor();
                    }
                    long bits = VeilForge.capacity(carrierBytes, type, factor);
                    out.println(type.tag() + " capacity at redundancy " + factor + ": " + bits + " bits ("
                        + (bits / 8) + " bytes of container)");
                    return 0;
                }
                case "detect": {
                    if (pos.isEmpty()) {
                        usage(out);
                        return 2;
                    }
                    File file = new File(pos.get(0));
                    out.println(CarrierType.detect(file.getName(), readAllBytes(file)).tag());
                    return 0;
                }
                default:
                    usage(out);
                    return 2;
            }
        } catch (StegoException exc) {
            err.println("Error: " + exc.kind() + ": " + exc.getMessage());
            return 1;
        } catch (RuntimeException exc) {
            err.println("Error: " + exc.getMessage());
            return 1;
        }
    }

    private static GlobalOptions parseGlobalOptions(String[] args) {
        boolean verbose = false;
        boolean noLog = false;
        List<String> cleaned = new ArrayList<String>(args.length);
        for (String arg : args) {
            if ("--verbose".equals(arg) || "-v".equals(arg)) {
                verbose = true;
                continue;
            }
            if ("--no-log".equals(arg)) {
                noLog = true;
                continue;
            }
            cleaned.add(arg);
        }
        return new GlobalOptions(verbose, noLog, cleaned.toArray(new String[0]));
    }

    private static CommandArgs parseCommandArgs(String[] args) {
        CommandArgs parsed = new CommandArgs();
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--") && arg.length() > 2) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + arg);
                }
                parsed.options.put(arg.substring(2), args[++i]);
            } else {
                parsed.positional.add(arg);
            }
        }
        return parsed;
    }

    private static CarrierType carrierType(CommandArgs parsed, File file, byte[] data) {
        String tag = parsed.option("type");
        return tag != null ? CarrierType.fromTag(tag) : CarrierType.detect(file.getName(), data);
    }

    private static HideOptions hideOptions(CommandArgs parsed) {
        HideOptions options = HideOptions.defaults();
        String redundancy = parsed.option("redundancy");
        if (redundancy != null) {
            options = options.withRedundancy(Redundancy.parse(redundancy));
        }
        String kdf = parsed.option("kdf");
        if (kdf != null) {
            options = options.withKdf(KdfParams.parse(kdf));
        }
        return options;
    }

    private static File outputFor(String explicit, ExtractedPayload extracted) {
        if (explicit != null) {
            File target = new File(explicit);
            if (target.isDirectory() && extracted.originalFilename() != null) {
                return new File(target, safeName(extracted.originalFilename()));
            }
            return target;
        }
        String name = extracted.originalFilename();
        return new File(name == null ? "extracted.bin" : safeName(name));
    }

    // stored names come from the carrier; never let them escape the target directory
    static String safeName(String name) {
        String base = name.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        if (base.isEmpty() || ".".equals(base) || "..".equals(base)) {
            return "extracted.bin";
        }
        return base;
    }

    private static byte[] readAllBytes(File file) {
        try {
            return Files.readAllBytes(file.toPath());
        } catch (IOException exc) {
            throw new UncheckedIOException("Failed to read file: " + file.getPath(), exc);
        }
    }

    private static void writeAllBytes(File file, byte[] data) {
        try {
            Path parent = file.toPath().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file.toPath(), data);
        } catch (IOException exc) {
            throw new UncheckedIOException("Failed to write file: " + file.getPath(), exc);
        }
    }

    private static void usage(PrintStream out) {
        out.println("VeilForge CLI");
        out.println("  [global] --verbose|-v --no-log");
        out.println("  hide <carrier> <payload-file> <out> [--password <pw>] [--type <t>] [--redundancy auto|N] [--kdf <k>]");
        out.println("  hide-text <carrier> <text> <out> [--password <pw>] [--type <t>] [--redundancy auto|N] [--kdf <k>]");
        out.println("  extract <carrier> [--out <path>] [--password <pw>] [--type <t>]");
        out.println("  capacity <carrier> [--type <t>] [--redundancy N]");
        out.println("  detect <file>");
        out.println("  types: image audio video document");
        out.println("  kdf:   pbkdf2[:iters] argon2id[:iters]");
    }
}
