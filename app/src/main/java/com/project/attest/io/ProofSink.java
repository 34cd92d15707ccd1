package com.project.attest.io;

import com.project.attest.proof.ProofArtifact;

import java.io.IOException;

/**
 * Where sealed artifacts go once assembled.
 */
public interface ProofSink {

    void accept(ProofArtifact artifact) throws IOException;
}
