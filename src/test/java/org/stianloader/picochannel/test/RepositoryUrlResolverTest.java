package org.stianloader.picochannel.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Paths;

import org.junit.jupiter.api.Test;
import org.stianloader.picochannel.repo.RepositoryUrlResolver;
import org.stianloader.picochannel.repo.RepositoryUrls;

public class RepositoryUrlResolverTest {

    @Test
    public void testProtocolRelative() {
        assertEquals("http://cdn.example.com/repo.json", new RepositoryUrlResolver("http://example.com/channel.json", false).resolve("//cdn.example.com/repo.json"));
        assertEquals("https://cdn.example.com/repo.json", new RepositoryUrlResolver("https://example.com/channel.json", false).resolve("//cdn.example.com/repo.json"));
        assertEquals("HTTPS://cdn.example.com/repo.json", new RepositoryUrlResolver("HTTPS://example.com/channel.json", false).resolve("//cdn.example.com/repo.json"));
        assertEquals("https://cdn.example.com/repo.json", new RepositoryUrlResolver("/srv/channel.json", false).resolve("//cdn.example.com/repo.json"));
    }

    @Test
    public void testRootAbsoluteSkipped() {
        assertNull(new RepositoryUrlResolver("https://example.com/channel.json", false).resolve("/etc/passwd"));
        assertNull(new RepositoryUrlResolver("/a/b/channel.json", false).resolve("/etc/passwd"));
    }

    @Test
    public void testRelativeToUrl() {
        RepositoryUrlResolver resolver = new RepositoryUrlResolver("https://example.com/channels/v3/channel.json", false);
        assertTrue(resolver.isRemoteChannel());
        assertEquals("https://example.com/channels/v3/repository.json", resolver.resolve("./repository.json"));
        assertEquals("https://example.com/channels/other/repository.json", resolver.resolve("../other/repository.json"));
    }

    @Test
    public void testRelativeAboveRoot() {
        assertEquals("https://example.com/x.json", new RepositoryUrlResolver("https://example.com/channel.json", false).resolve("../x.json"));
        assertEquals("https://example.com/x.json", new RepositoryUrlResolver("https://example.com/a/channel.json", false).resolve("../../x.json"));
        assertEquals("https://example.com/x.json?token=1", new RepositoryUrlResolver("https://example.com/channel.json", false).resolve("../../x.json?token=1"));
    }

    @Test
    public void testRelativeToFile() {
        RepositoryUrlResolver resolver = new RepositoryUrlResolver("/a/b/channel.json", false);
        assertFalse(resolver.isRemoteChannel());
        assertEquals(Paths.get("/a/other/channel.json").toString(), resolver.resolve("../other/channel.json"));
        assertEquals(Paths.get("/a/b/repository.json").toString(), resolver.resolve("./repository.json"));
        assertEquals(Paths.get("/a/b/nested/repository.json").toString(), resolver.resolve("./nested/../nested/./repository.json"));
    }

    @Test
    public void testRelativeToBareFileName() {
        assertEquals(Paths.get("../repository.json").toString(), new RepositoryUrlResolver("channel.json", false).resolve("../repository.json"));
    }

    @Test
    public void testPassThrough() {
        RepositoryUrlResolver resolver = new RepositoryUrlResolver("https://example.com/channel.json", false);
        assertEquals("https://example.com/repository.json", resolver.resolve("https://example.com/repository.json"));
        assertEquals("repository.json", resolver.resolve("repository.json"));
    }

    @Test
    public void testLegacyHostsRewritten() {
        RepositoryUrlResolver resolver = new RepositoryUrlResolver("https://example.com/channel.json", false);
        assertEquals("https://raw.githubusercontent.com/user/repo/master/repository.json", resolver.resolve("https://raw.github.com/user/repo/master/repository.json"));
        assertEquals(RepositoryUrls.CURRENT_CHANNEL, resolver.resolve("https://sublime.wbond.net/repositories.json"));
    }

    @Test
    public void testUpdate() {
        assertNull(RepositoryUrls.update(null, false));
        assertEquals("", RepositoryUrls.update("", false));
        assertEquals("https://raw.githubusercontent.com/a/b/master/x.json", RepositoryUrls.update("https://raw.github.com/a/b/master/x.json", false));
        assertEquals("https://codeload.github.com/a/b/zip/master", RepositoryUrls.update("https://nodeload.github.com/a/b/zipball/master", true));
        assertEquals("https://codeload.github.com/a/b/zip/1.0.0", RepositoryUrls.update("https://codeload.github.com/a/b/zipball/1.0.0", false));
        assertEquals(RepositoryUrls.CURRENT_CHANNEL, RepositoryUrls.update("https://sublime.wbond.net/channel.json", false));
        assertEquals("https://sublime.wbond.net/other.json", RepositoryUrls.update("https://sublime.wbond.net/other.json", false));
        assertEquals("https://example.com/repository.json", RepositoryUrls.update("https://example.com/repository.json", false));
    }
}
