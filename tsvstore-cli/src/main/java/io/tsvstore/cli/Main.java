/*
 * Copyright 2024 TsvStore.
 *
 * This file is part of TsvStore.
 *
 * TsvStore is free software: you can redistribute it and/or modify
 * it under the terms of the Affero GNU General Public License as
 * published by the Free Software Foundation, either version 3 of
 * the License, or (at your option) any later version.
 *
 * TsvStore is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Affero GNU General Public License for more details.
 *
 * You should have received a copy of the Affero GNU General Public
 * License along with TsvStore.  If not, see
 * <https://www.gnu.org/licenses/>.
 */
package io.tsvstore.cli;

import io.tsvstore.cli.executor.CommandExecutor;
import io.tsvstore.cli.executor.LoadExecutor;
import io.tsvstore.cli.executor.StatExecutor;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

import java.util.Scanner;

/**
 * tsvstore command line tool
 * <p>
 * LOAD -h /data/header.tsv -i /data/part-00000.tsv /data/part-00001.tsv -b age,income -r score -s city -c 8
 * </p>
 * <p>
 * LOAD -h /data/header.tsv -i /data/parts -f /data/columns.properties
 * </p>
 * <p>
 * STAT
 * </p>
 * <p>
 * STAT -n city
 * </p>
 */
public class Main
{
    public static void main(String[] args)
    {
        Scanner scanner = new Scanner(System.in);
        Session session = new Session();
        String inputStr;

        while (true)
        {
            System.out.print("tsvstore> ");
            if (scanner.hasNextLine())
            {
                inputStr = scanner.nextLine().trim();
            }
            else
            {
                // input from a file ends at EOF
                System.out.println("Bye.");
                break;
            }

            if (!runCommand(session, inputStr))
            {
                System.out.println("Bye.");
                break;
            }
        }
        // Use exit to terminate other threads and invoke the shutdown hooks.
        scanner.close();
        System.exit(0);
    }

    /**
     * Run one line of input.
     * @param session the state of the shell
     * @param inputStr the line
     * @return false if the shell should exit
     */
    public static boolean runCommand(Session session, String inputStr)
    {
        inputStr = inputStr.trim();
        if (inputStr.isEmpty() || inputStr.equals(";"))
        {
            return true;
        }

        if (inputStr.endsWith(";"))
        {
            inputStr = inputStr.substring(0, inputStr.length() - 1);
        }

        if (inputStr.equalsIgnoreCase("exit") || inputStr.equalsIgnoreCase("quit") ||
                inputStr.equalsIgnoreCase("-q"))
        {
            return false;
        }

        if (inputStr.equalsIgnoreCase("help"))
        {
            System.out.println("Supported commands:\n" +
                    "LOAD\n" +
                    "STAT");
            System.out.println("{command} --help to show the usage of a command.\nexit / quit / -q to exit.\n");
            return true;
        }

        String command = inputStr.split("\\s+")[0].toUpperCase();
        ArgumentParser argumentParser;
        CommandExecutor executor;
        if (command.equals("LOAD"))
        {
            argumentParser = newLoadParser();
            executor = new LoadExecutor(session);
        }
        else if (command.equals("STAT"))
        {
            argumentParser = newStatParser();
            executor = new StatExecutor(session);
        }
        else
        {
            System.out.println("Command error");
            return true;
        }

        String arguments = inputStr.substring(command.length()).trim();
        Namespace ns;
        try
        {
            ns = argumentParser.parseArgs(arguments.isEmpty() ? new String[0] : arguments.split("\\s+"));
        }
        catch (ArgumentParserException e)
        {
            argumentParser.handleError(e);
            return true;
        }

        try
        {
            executor.execute(ns, command);
        }
        catch (Exception e)
        {
            e.printStackTrace();
        }
        return true;
    }

    public static ArgumentParser newLoadParser()
    {
        // -h is the header file, so the help option is --help only
        ArgumentParser argumentParser = ArgumentParsers.newFor("TsvStore LOAD").addHelp(false).build()
                .defaultHelp(true);

        argumentParser.addArgument("--help").action(Arguments.help())
                .help("show this help message and exit");
        argumentParser.addArgument("-h", "--header").required(true)
                .help("specify the path of the header file");
        argumentParser.addArgument("-i", "--input").nargs("+").required(true)
                .help("specify the data files or the directories of data files, loaded in this order");
        argumentParser.addArgument("-b", "--binned")
                .help("specify the comma separated names of the binned float columns");
        argumentParser.addArgument("-r", "--raw")
                .help("specify the comma separated names of the raw float columns");
        argumentParser.addArgument("-s", "--string")
                .help("specify the comma separated names of the string columns");
        argumentParser.addArgument("-f", "--properties")
                .help("specify the properties file of the columns, used if -b, -r and -s are absent");
        argumentParser.addArgument("-c", "--concurrency").type(Integer.class)
                .help("specify the number of threads of each worker pool");
        return argumentParser;
    }

    public static ArgumentParser newStatParser()
    {
        ArgumentParser argumentParser = ArgumentParsers.newFor("TsvStore STAT").build()
                .defaultHelp(true);

        argumentParser.addArgument("-n", "--column")
                .help("specify the name of the column to show in detail");
        return argumentParser;
    }
}
