package com.example.cruisesync.infrastructure.ftp;

import com.example.cruisesync.domain.model.RemoteEntry;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.commons.net.ftp.FTPReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FtpRemoteSession implements RemoteSession {

    private static final Logger log = LoggerFactory.getLogger(FtpRemoteSession.class);

    private final FTPClient client;
    private final String host;

    public FtpRemoteSession(FTPClient client, String host) {
        this.client = client;
        this.host = host;
    }

    @Override
    public List<RemoteEntry> list(String path) throws IOException {
        FTPFile[] files = client.listFiles(path);
        checkReply(path, "LIST");
        List<RemoteEntry> entries = new ArrayList<>();
        if (files == null) {
            return entries;
        }
        for (FTPFile file : files) {
            if (file == null) {
                continue;
            }
            String name = file.getName();
            if (name == null || ".".equals(name) || "..".equals(name)) {
                continue;
            }
            entries.add(file.isDirectory()
                    ? RemoteEntry.directory(name)
                    : RemoteEntry.file(name, file.getSize()));
        }
        return entries;
    }

    @Override
    public byte[] retrieve(String path) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        boolean ok = client.retrieveFile(path, out);
        if (!ok) {
            checkReply(path, "RETR");
            throw new IOException("RETR failed for " + path + ", reply=" + client.getReplyString());
        }
        return out.toByteArray();
    }

    @Override
    public boolean isConnected() {
        return client.isConnected();
    }

    @Override
    public void close() {
        if (!client.isConnected()) {
            return;
        }
        try {
            client.logout();
        } catch (IOException e) {
            log.debug("FTP logout failed, host={}", host, e);
        }
        try {
            client.disconnect();
        } catch (IOException e) {
            log.debug("FTP disconnect failed, host={}", host, e);
        }
    }

    private void checkReply(String path, String command) throws IOException {
        int reply = client.getReplyCode();
        if (FTPReply.isPositiveCompletion(reply) || FTPReply.isPositivePreliminary(reply)) {
            return;
        }
        if (reply == FTPReply.FILE_UNAVAILABLE) {
            throw new RemoteNotFoundException(path);
        }
        // servers answer 450 for a LIST of a month directory that is not published yet
        if (reply == FTPReply.FILE_ACTION_NOT_TAKEN && "LIST".equals(command)) {
            throw new RemoteNotFoundException(path);
        }
        if (reply == FTPReply.NOT_LOGGED_IN) {
            throw new RemoteAuthException("Session no longer authenticated on " + host, path);
        }
        if (FTPReply.isNegativePermanent(reply) || FTPReply.isNegativeTransient(reply)) {
            throw new IOException(command + " failed for " + path + ", reply=" + reply);
        }
    }
}
