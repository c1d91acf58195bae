package org.stianloader.picochannel.test;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;

final class ChannelFixtures {

    static byte @NotNull[] read(@NotNull String fixture) {
        try (InputStream is = ChannelFixtures.class.getResourceAsStream("/channels/" + fixture)) {
            return Objects.requireNonNull(is, "Missing fixture " + fixture).readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Copies a fixture to "channel.json" within a directory.
     *
     * @param fixture The name of the fixture
     * @param directory The target directory
     * @return The path of the copied channel
     */
    @NotNull
    static Path install(@NotNull String fixture, @NotNull Path directory) throws IOException {
        Path channel = directory.resolve("channel.json");
        Files.write(channel, ChannelFixtures.read(fixture));
        return channel;
    }

    private ChannelFixtures() {
        throw new AssertionError();
    }
}
