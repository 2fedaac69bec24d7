/*
 * Copyright 2026 QR Locator authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.qrlocator.client.j2se;

import javax.swing.*;
import javax.swing.text.JTextComponent;
import java.awt.*;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * <p>Simple GUI frontend to the locator. Shows a local image with the position of its
 * finder and alignment patterns, or prints them for every image of a directory.</p>
 *
 * @author QR Locator authors
 */
public final class GUIRunner extends JFrame {

  public static final String LOCATOR_GUI = ".qrlocator-gui";
  public static final String LAST_PATH = "lastPath";
  private final JLabel imageLabel;
  private final JTextComponent textArea;
  private final Properties prefs = new Properties();

  private GUIRunner() {
    super("QR Locator");
    imageLabel = new JLabel();
    textArea = new JTextArea(6, 40);
    textArea.setEditable(false);
    JPanel content = new JPanel(new BorderLayout());
    content.add(new JScrollPane(imageLabel), BorderLayout.CENTER);
    content.add(textArea, BorderLayout.SOUTH);
    setContentPane(content);
    setDefaultCloseOperation(WindowConstants.EXIT_ON_CLOSE);
    setSize(400, 400);
    setLocationRelativeTo(null);
  }

  public static void main(String[] args) {
    SwingUtilities.invokeLater(new Runnable() {
      @Override
      public void run() {
        GUIRunner runner = new GUIRunner();
        runner.setVisible(true);
        try {
          runner.chooseImage();
        } catch (IOException ioe) {
          JOptionPane.showMessageDialog(runner, ioe.toString(), "QR Locator", JOptionPane.ERROR_MESSAGE);
          runner.dispose();
        }
      }
    });
  }

  private synchronized void savePrefs() throws IOException {
    try (FileOutputStream out = new FileOutputStream(prefsFile())) {
      prefs.storeToXML(out, "QR Locator gui preferences");
    }
  }

  private void chooseImage() throws IOException {
    final JFileChooser fileChooser = new JFileChooser();
    fileChooser.setFileSelectionMode(JFileChooser.FILES_AND_DIRECTORIES);

    final File prefFile = prefsFile();
    if (prefFile.exists()) {
      try (FileInputStream in = new FileInputStream(prefFile)) {
        prefs.loadFromXML(in);
      }
    }
    fileChooser.setCurrentDirectory(new File(prefs.getProperty(LAST_PATH, System.getProperty("user.home"))));

    if (fileChooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) {
      return;
    }
    Path file = fileChooser.getSelectedFile().toPath();
    if (Files.isDirectory(file)) {
      prefs.setProperty(LAST_PATH, file.toString());
      savePrefs();

      try (DirectoryStream<Path> stream = Files.newDirectoryStream(file)) {
        for (Path entry : stream) {
          if (Files.isDirectory(entry)) {
            continue;
          }
          System.out.println(String.format("%s : %s", entry.getFileName(), ImageLocator.getLocateText(entry)));
        }
      }
    } else {
      prefs.setProperty(LAST_PATH, file.getParent().toString());
      savePrefs();

      Icon imageIcon = new ImageIcon(file.toUri().toURL());
      setSize(imageIcon.getIconWidth(), imageIcon.getIconHeight() + 100);
      imageLabel.setIcon(imageIcon);

      String locateText = ImageLocator.getLocateText(file);
      System.out.println(String.format("%s : %s", file, locateText));
      textArea.setText(locateText.replace(" ", "\n"));
    }
  }

  private static File prefsFile() {
    return new File(System.getProperty("user.home"), LOCATOR_GUI);
  }

}
