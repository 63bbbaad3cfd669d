package org.metalad.filestore;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.stream.Stream;

import javax.xml.bind.DatatypeConverter;

/**
 * FileStoreUtility is a utility class that encapsulates generic or shared functionality of the
 * file based object store and version index.
 */
public class FileStoreUtility {

    private static final Log log = LogFactory.getLog(FileStoreUtility.class);

    /**
     * Checks whether a given object is null and throws an exception if so
     *
     * @param object   Object to check
     * @param argument Value that is being checked
     * @param method   Calling method or class
     * @throws IllegalArgumentException If the object is null
     */
    public static void ensureNotNull(Object object, String argument, String method)
        throws IllegalArgumentException {
        if (object == null) {
            String errMsg = "Calling Method: " + method + "(): " + argument + " cannot be null.";
            throw new IllegalArgumentException(errMsg);
        }
    }

    /**
     * Checks whether a given string is empty or contains white space, and throws an exception if
     * so
     *
     * @param string   String to check
     * @param argument Value that is being checked
     * @param method   Calling method
     * @throws IllegalArgumentException If the string is empty or contains white space
     */
    public static void checkForEmptyAndValidString(String string, String argument, String method)
        throws IllegalArgumentException {
        ensureNotNull(string, argument, method);
        if (string.trim().isEmpty()) {
            String errMsg = "Calling Method: " + method + "(): " + argument + " cannot be empty.";
            throw new IllegalArgumentException(errMsg);
        }
        if (!isValidString(string)) {
            String errMsg = "Calling Method: " + method + "(): " + argument
                + " contains empty white spaces, tabs or newlines.";
            throw new IllegalArgumentException(errMsg);
        }
    }

    /**
     * @param string String to check
     * @return True if the string contains no white space characters
     */
    public static boolean isValidString(String string) {
        for (int i = 0; i < string.length(); i++) {
            if (Character.isWhitespace(string.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Given a string and a supported algorithm, returns the hex digest of its UTF-8 bytes
     *
     * @param string    Value to digest, like a dataset version
     * @param algorithm String value (ex. SHA-256)
     * @return Hex digest of the given string in lower-case
     * @throws IllegalArgumentException String or algorithm cannot be null or empty
     * @throws NoSuchAlgorithmException Algorithm not supported
     */
    public static String getStringHexDigest(String string, String algorithm)
        throws NoSuchAlgorithmException, IllegalArgumentException {
        ensureNotNull(string, "string", "getStringHexDigest");
        if (string.isEmpty()) {
            throw new IllegalArgumentException(
                "Calling Method: getStringHexDigest(): string cannot be empty.");
        }
        checkForEmptyAndValidString(algorithm, "algorithm", "getStringHexDigest");

        MessageDigest stringMessageDigest = MessageDigest.getInstance(algorithm);
        stringMessageDigest.update(string.getBytes(StandardCharsets.UTF_8));
        return DatatypeConverter.printHexBinary(stringMessageDigest.digest()).toLowerCase();
    }

    /**
     * Checks whether a directory contains any entry
     *
     * @param directory Directory to check
     * @return True if the directory has at least one entry
     * @throws IOException If I/O occurs when accessing directory
     */
    public static boolean dirContainsFiles(Path directory) throws IOException {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.findFirst().isPresent();
        }
    }

    /**
     * Walks a directory and returns the regular files found below it
     *
     * @param directory Directory to walk
     * @return List<Path> of files, empty if the directory does not exist
     * @throws IOException If I/O occurs when accessing directory
     */
    public static List<Path> getFilesFromDir(Path directory) throws IOException {
        List<Path> filePaths = new ArrayList<>();
        if (Files.isDirectory(directory) && dirContainsFiles(directory)) {
            try (Stream<Path> stream = Files.walk(directory)) {
                stream.filter(Files::isRegularFile).forEach(filePaths::add);
            }
        }
        return filePaths;
    }

    /**
     * Generates a hierarchical path by dividing a given digest into tokens of fixed width, and
     * concatenating them with '/' as the delimiter. The rest of the digest is the last token.
     *
     * @param depth  integer to represent number of directories
     * @param width  width of each directory
     * @param digest value to shard
     * @return String
     */
    public static String getHierarchicalPathString(int depth, int width, String digest) {
        Collection<String> tokens = new ArrayList<>();
        int digestLength = digest.length();
        for (int i = 0; i < depth; i++) {
            int start = Math.min(i * width, digestLength);
            int end = Math.min((i + 1) * width, digestLength);
            String token = digest.substring(start, end);
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        if (depth * width < digestLength) {
            tokens.add(digest.substring(depth * width));
        }
        return String.join("/", tokens);
    }

    /**
     * Creates an empty temporary file in a given location. If this file is not moved, it will be
     * deleted upon JVM gracefully exiting or shutting down.
     *
     * @param prefix    string to prepend before tmp file
     * @param directory location to create tmp file
     * @return Temporary file ready to write into
     * @throws IOException Issues with generating tmpFile
     */
    public static File generateTmpFile(String prefix, Path directory) throws IOException {
        Path newPath = Files.createTempFile(directory, uniquePrefix(prefix), null);
        File newFile = newPath.toFile();
        newFile.deleteOnExit();
        return newFile;
    }

    /**
     * Creates an empty temporary directory in a given location
     *
     * @param prefix    string to prepend before tmp directory
     * @param directory location to create tmp directory
     * @return Path of the new directory
     * @throws IOException Issues with generating the directory
     */
    public static Path generateTmpDirectory(String prefix, Path directory) throws IOException {
        return Files.createTempDirectory(directory, uniquePrefix(prefix));
    }

    private static String uniquePrefix(String prefix) {
        int randomNumber = new Random().nextInt(1000000);
        return prefix + "-" + System.currentTimeMillis() + randomNumber + "-";
    }

    /**
     * Moves a file or directory atomically, creating the parent directories of the target. When
     * the target already exists, the move is skipped and false is returned.
     *
     * @param source File or directory to move
     * @param target Where to move it
     * @return True if the source was moved, false if the target already existed
     * @throws AtomicMoveNotSupportedException When moving across file systems
     * @throws IOException                     Unable to create parent directory or move
     */
    public static boolean atomicMove(Path source, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null && !Files.exists(parent)) {
            try {
                Files.createDirectories(parent);

            } catch (FileAlreadyExistsException faee) {
                log.debug("Directory already exists at: " + parent);
            }
        }
        if (Files.exists(target)) {
            return false;
        }

        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Moved from: " + source + ", to: " + target);
            return true;

        } catch (FileAlreadyExistsException faee) {
            log.debug("Target already exists, skipping move. Source: " + source + ". Target: "
                          + target);
            return false;

        } catch (AtomicMoveNotSupportedException amnse) {
            log.error("StandardCopyOption.ATOMIC_MOVE failed. AtomicMove is not supported across"
                          + " file systems. Source: " + source + ". Target: " + target);
            throw amnse;
        }
    }

    /**
     * Replace the content of a small file atomically: the bytes are written to a temporary file
     * in `tmpDirectory` which then replaces the target.
     *
     * @param target       File to replace
     * @param content      New content
     * @param tmpDirectory Directory on the same file system as the target
     * @throws IOException Unable to write or move
     */
    public static void replaceAtomically(Path target, byte[] content, Path tmpDirectory)
        throws IOException {
        File tmpFile = generateTmpFile("replace", tmpDirectory);
        try {
            Files.write(tmpFile.toPath(), content);
            Files.createDirectories(target.getParent());
            Files.move(
                tmpFile.toPath(), target, StandardCopyOption.ATOMIC_MOVE,
                StandardCopyOption.REPLACE_EXISTING
            );

        } catch (IOException ioe) {
            Files.deleteIfExists(tmpFile.toPath());
            String errMsg = "Unable to replace file: " + target + ". " + ioe.getMessage();
            log.error(errMsg);
            throw ioe;
        }
    }

    /**
     * Delete a directory and everything below it, if it exists
     *
     * @param directory Directory to delete
     * @throws IOException Unable to delete an entry
     */
    public static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        List<Path> paths = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(directory)) {
            stream.sorted(Comparator.reverseOrder()).forEach(paths::add);
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }

    /**
     * Ensures that two configuration values are equal. If not, throws an
     * IllegalArgumentException.
     *
     * @param nameValue     The name of the value being checked
     * @param suppliedValue The value supplied to compare
     * @param existingValue The existing value to compare with
     * @throws IllegalArgumentException If the supplied value is not equal to the existing value
     */
    public static void checkObjectEquality(
        String nameValue, Object suppliedValue, Object existingValue) {
        if (!Objects.equals(suppliedValue, existingValue)) {
            String errMsg = "Mismatch in " + nameValue + ": " + suppliedValue
                + " does not match the existing configuration value: " + existingValue;
            throw new IllegalArgumentException(errMsg);
        }
    }
}
