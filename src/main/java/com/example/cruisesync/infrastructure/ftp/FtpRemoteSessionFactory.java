package com.example.cruisesync.infrastructure.ftp;

import com.example.cruisesync.common.config.AppFtpProperties;
import java.io.IOException;
import java.time.Duration;
import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FtpRemoteSessionFactory implements RemoteSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(FtpRemoteSessionFactory.class);

    private final AppFtpProperties properties;

    public FtpRemoteSessionFactory(AppFtpProperties properties) {
        this.properties = properties;
    }

    @Override
    public RemoteSession open() throws IOException {
        FTPClient client = new FTPClient();
        client.setConnectTimeout(properties.getConnectTimeoutMs());
        client.setDefaultTimeout(properties.getCallTimeoutMs());
        client.setDataTimeout(Duration.ofMillis(properties.getCallTimeoutMs()));
        try {
            client.connect(properties.getHost(), properties.getPort());
            int reply = client.getReplyCode();
            if (!FTPReply.isPositiveCompletion(reply)) {
                throw new IOException("FTP server refused connection, reply=" + reply);
            }
            client.setSoTimeout(properties.getCallTimeoutMs());
            if (!client.login(properties.getUsername(), properties.getPassword())) {
                throw new RemoteAuthException("FTP login rejected by " + host()
                        + ", reply=" + client.getReplyCode(), properties.getRootPath());
            }
            client.setFileType(FTP.BINARY_FILE_TYPE);
            if (properties.isPassiveMode()) {
                client.enterLocalPassiveMode();
            }
            log.info("FTP_SESSION_OPENED host={} port={}", properties.getHost(), properties.getPort());
            return new FtpRemoteSession(client, host());
        } catch (IOException | RuntimeException e) {
            disconnectSafely(client);
            throw e;
        }
    }

    @Override
    public String host() {
        return properties.getHost();
    }

    private void disconnectSafely(FTPClient client) {
        if (!client.isConnected()) {
            return;
        }
        try {
            client.disconnect();
        } catch (IOException e) {
            log.debug("FTP disconnect after failed open failed, host={}", host(), e);
        }
    }
}
