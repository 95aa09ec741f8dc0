///usr/bin/env jbang "$0" "$@" ; exit $?
//JAVA 17
//REPOS central=https://repo1.maven.org/maven2/
//DEPS org.springaicommunity:dockerhub-status-cli:1.0.0-SNAPSHOT

import org.springaicommunity.dockerhub.status.cli.DockerHubStatusCli;

public class dockerhub_status {
    public static void main(String[] args) throws Exception {
        DockerHubStatusCli.main(args);
    }
}
