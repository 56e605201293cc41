package com.example.bankletter;

import java.io.IOException;
import java.nio.file.Path;

/** Reads the page text an agreement's fields are extracted from. */
public interface AgreementTextSource {

    AgreementText read(Path pdf) throws IOException;

    AgreementText read(byte[] pdf) throws IOException;
}
